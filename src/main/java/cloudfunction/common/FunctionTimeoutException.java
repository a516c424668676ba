package cloudfunction.common;

import java.time.Duration;

/**
 * No reply arrived within the configured execution timeout.
 */
public class FunctionTimeoutException extends CloudFunctionException {

    public FunctionTimeoutException(String projectName, String functionName, Duration timeout) {
        super("Function " + functionName + " in project " + projectName + " timed out after " + timeout);
    }
}
