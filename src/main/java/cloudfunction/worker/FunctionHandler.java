package cloudfunction.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A resolved, callable function entry point.
 */
public interface FunctionHandler {

    /**
     * True when {@link #invoke} returns a {@link java.util.concurrent.CompletionStage}
     * that must be awaited instead of a plain value.
     */
    boolean isAsync();

    Object invoke(JsonNode payload) throws Exception;
}
