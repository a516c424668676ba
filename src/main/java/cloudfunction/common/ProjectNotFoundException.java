package cloudfunction.common;

/**
 * The named project does not exist under the projects root.
 */
public class ProjectNotFoundException extends CloudFunctionException {

    private final String projectName;

    public ProjectNotFoundException(String projectName) {
        super("Project not found: " + projectName);
        this.projectName = projectName;
    }

    public String projectName() {
        return projectName;
    }
}
