package cloudfunction.common;

/**
 * Invalid wiring or setup: unknown component name, missing project directory,
 * malformed schedule definition.
 */
public class ConfigurationException extends CloudFunctionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
