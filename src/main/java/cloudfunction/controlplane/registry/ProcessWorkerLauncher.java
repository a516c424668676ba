package cloudfunction.controlplane.registry;

import cloudfunction.common.NamedThreadFactory;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.environment.ProjectEnvironment;
import cloudfunction.protocol.MessagePump;
import cloudfunction.protocol.StreamMessageSink;
import cloudfunction.worker.WorkerMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Launches each worker as a child JVM running {@link WorkerMain}.
 * The child's stdout is pumped into the project channel; its stderr goes to the project log file.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    private final ControlPlaneConfig config;
    private final ExecutorService pumps = Executors.newCachedThreadPool(new NamedThreadFactory("worker-pump-"));

    public ProcessWorkerLauncher(ControlPlaneConfig config) {
        this.config = config;
    }

    @Override
    public ManagedProcess launch(String project, MessageChannel channel) throws IOException {
        Path projectDir = config.projectsDir().resolve(project);
        ProcessBuilder pb = new ProcessBuilder(command(project));
        pb.environment().putAll(ProjectEnvironment.load(config.systemEnvFile(), projectDir));

        if (config.inheritWorkerOutput()) {
            pb.redirectError(ProcessBuilder.Redirect.INHERIT);
        } else {
            Path logFile = config.logsDir().resolve("projects").resolve(project + ".log");
            Files.createDirectories(logFile.getParent());
            pb.redirectError(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        }

        Process process = pb.start();
        StreamMessageSink stdin = new StreamMessageSink(process.getOutputStream());
        channel.attach(stdin);
        pumps.execute(new MessagePump("worker-" + project, process.getInputStream(), channel::deliver,
                () -> log.debug("Output of worker for project {} closed", project)));
        log.info("Launched worker for project {} (pid {})", project, process.pid());
        return new OsProcess(process, stdin);
    }

    List<String> command(String project) {
        List<String> cmd = new ArrayList<>();
        cmd.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        cmd.addAll(config.workerJvmOptions());
        cmd.add("-cp");
        cmd.add(config.workerClasspath());
        cmd.add(WorkerMain.class.getName());
        cmd.add("--project");
        cmd.add(project);
        cmd.add("--projects-dir");
        cmd.add(config.projectsDir().toAbsolutePath().toString());
        cmd.add("--envs-dir");
        cmd.add(config.envsDir().toAbsolutePath().toString());
        if (Files.isRegularFile(config.systemEnvFile())) {
            cmd.add("--system-env");
            cmd.add(config.systemEnvFile().toAbsolutePath().toString());
        }
        if (Files.isRegularFile(config.systemDependencies())) {
            cmd.add("--system-deps");
            cmd.add(config.systemDependencies().toAbsolutePath().toString());
        }
        cmd.add("--pool-size");
        cmd.add(String.valueOf(config.workerPoolSize()));
        cmd.add("--poll-millis");
        cmd.add(String.valueOf(config.responsePollInterval().toMillis()));
        return cmd;
    }

    @Override
    public void close() {
        pumps.shutdownNow();
    }
}
