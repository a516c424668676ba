package cloudfunction.common;

/**
 * A handler raised while executing. The message is the worker-reported error, verbatim.
 */
public class FunctionExecutionException extends CloudFunctionException {

    private final String projectName;
    private final String functionName;

    public FunctionExecutionException(String projectName, String functionName, String message) {
        super(message);
        this.projectName = projectName;
        this.functionName = functionName;
    }

    public String projectName() {
        return projectName;
    }

    public String functionName() {
        return functionName;
    }
}
