package cloudfunction.common;

/**
 * Root of the control plane's unchecked exception hierarchy.
 */
public class CloudFunctionException extends RuntimeException {

    public CloudFunctionException(String message) {
        super(message);
    }

    public CloudFunctionException(String message, Throwable cause) {
        super(message, cause);
    }
}
