package cloudfunction.common;

/**
 * No live worker could be obtained for a project, or the worker died mid-call.
 * The caller may re-invoke; the next call attempts a fresh restart.
 */
public class ProjectUnavailableException extends CloudFunctionException {

    private final String projectName;

    public ProjectUnavailableException(String projectName, String message) {
        super("Project " + projectName + " unavailable: " + message);
        this.projectName = projectName;
    }

    public ProjectUnavailableException(String projectName, String message, Throwable cause) {
        super("Project " + projectName + " unavailable: " + message, cause);
        this.projectName = projectName;
    }

    public String projectName() {
        return projectName;
    }
}
