package cloudfunction.common;

/**
 * A function descriptor could not be read, or its entry point could not be resolved.
 */
public class FunctionLoadException extends CloudFunctionException {

    public FunctionLoadException(String message) {
        super(message);
    }

    public FunctionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
