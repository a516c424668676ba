package cloudfunction.testfunctions;

import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.config.WorkerLaunchMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Builds project directories backed by {@link DemoFunctions}.
 */
public final class TestProjects {

    public static final String DEMO_CLASS = DemoFunctions.class.getName();

    private TestProjects() {
    }

    /**
     * Creates {@code <projectsDir>/<project>} with one descriptor per function; each function
     * name is also the {@link DemoFunctions} method it calls.
     */
    public static Path createProject(Path projectsDir, String project, String... functions) throws IOException {
        Path dir = projectsDir.resolve(project);
        Files.createDirectories(dir);
        for (String fn : functions) {
            writeDescriptor(dir, fn, DEMO_CLASS, fn);
        }
        return dir;
    }

    public static Path writeDescriptor(Path projectDir, String function, String className, String entry)
            throws IOException {
        Path file = projectDir.resolve(function + ".function.json");
        Files.writeString(file, "{\"class\":\"" + className + "\",\"entry\":\"" + entry
                + "\",\"description\":\"test function " + function + "\"}");
        return file;
    }

    /**
     * In-process workers, no HTTP server, short timeouts.
     */
    public static ControlPlaneConfig inProcessConfig(Path baseDir) {
        return ControlPlaneConfig.defaults()
                .withBaseDir(baseDir)
                .withApiEnabled(false)
                .withWorkerLaunchMode(WorkerLaunchMode.IN_PROCESS)
                .withWorkerPoolSize(4)
                .withWorkerReadyTimeout(Duration.ofSeconds(10))
                .withTerminateTimeout(Duration.ofSeconds(2))
                .withResponsePollInterval(Duration.ofMillis(100))
                .withTaskWorkers(4);
    }
}
