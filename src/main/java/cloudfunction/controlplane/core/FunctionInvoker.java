package cloudfunction.controlplane.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Synchronous function invocation.
 */
@FunctionalInterface
public interface FunctionInvoker {

    /**
     * @return the function's result
     * @throws cloudfunction.common.FunctionExecutionException if the function raised
     * @throws cloudfunction.common.ProjectUnavailableException if no live worker could be obtained
     * @throws cloudfunction.common.FunctionTimeoutException if an execution timeout is configured and exceeded
     */
    JsonNode executeFunction(String project, String function, JsonNode payload);
}
