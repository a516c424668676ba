package cloudfunction.environment;

import java.nio.file.Path;

/**
 * Opaque per-project environment owned by a provisioner.
 * Installed dependency jars live under {@link #libDir()}.
 */
public record EnvironmentHandle(String project, Path root) {

    public Path libDir() {
        return root.resolve("lib");
    }

    public Path lockFile() {
        return root.resolve(DependencyManifest.LOCK_FILE);
    }
}
