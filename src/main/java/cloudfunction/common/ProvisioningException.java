package cloudfunction.common;

/**
 * Environment or dependency setup failed for a project.
 */
public class ProvisioningException extends CloudFunctionException {

    private final String projectName;

    public ProvisioningException(String projectName, String message) {
        super(message);
        this.projectName = projectName;
    }

    public ProvisioningException(String projectName, String message, Throwable cause) {
        super(message, cause);
        this.projectName = projectName;
    }

    public String projectName() {
        return projectName;
    }
}
