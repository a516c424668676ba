package cloudfunction.environment;

import cloudfunction.common.ProvisioningException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment variables for one project: the system {@code .env} overlaid by the project's own.
 * The process environment is never modified; callers pass the map along explicitly.
 */
public final class ProjectEnvironment {

    public static final String FILE_NAME = ".env";

    private ProjectEnvironment() {
    }

    public static Map<String, String> load(Path systemEnvFile, Path projectDir) {
        Map<String, String> merged = new LinkedHashMap<>();
        try {
            merged.putAll(DotEnvParser.parse(systemEnvFile));
            if (projectDir != null) {
                merged.putAll(DotEnvParser.parse(projectDir.resolve(FILE_NAME)));
            }
        } catch (IOException e) {
            String project = projectDir == null ? null : String.valueOf(projectDir.getFileName());
            throw new ProvisioningException(project, "Failed to read environment file: " + e.getMessage(), e);
        }
        return Collections.unmodifiableMap(merged);
    }
}
