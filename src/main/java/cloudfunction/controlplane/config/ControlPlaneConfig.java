package cloudfunction.controlplane.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration holder for control plane settings.
 * All settings have sensible defaults; directories live under one base directory.
 */
public final class ControlPlaneConfig {

    // Server settings
    private String serverHost = "0.0.0.0";
    private int serverPort = 8080;
    private boolean apiEnabled = true;

    // Layout
    private Path baseDir = Paths.get("cloudfunction");
    private Path projectsDir;
    private Path envsDir;
    private Path tasksDir;
    private Path logsDir;
    private Path scheduleFile;
    private Path systemEnvFile;
    private Path systemDependencies;

    // Worker settings
    private WorkerLaunchMode workerLaunchMode = WorkerLaunchMode.PROCESS;
    private int workerPoolSize = 10;
    private Duration workerReadyTimeout = Duration.ofSeconds(30);
    private Duration terminateTimeout = Duration.ofSeconds(5);
    private Duration executionTimeout = null; // unbounded
    private Duration responsePollInterval = Duration.ofSeconds(1);
    private int channelCapacity = 1024;
    private List<String> workerJvmOptions = new ArrayList<>();
    private String workerClasspath = null; // defaults to java.class.path
    private boolean inheritWorkerOutput = false;

    // API settings
    private Duration apiReadyTimeout = Duration.ofSeconds(10);

    // Task settings
    private int taskWorkers = 10;
    private int taskRetentionDays = 7;
    private Duration taskSweepInterval = Duration.ofHours(1);
    private ZoneId scheduleZone = ZoneId.systemDefault();

    private ControlPlaneConfig() {
    }

    public static ControlPlaneConfig defaults() {
        return new ControlPlaneConfig();
    }

    public static ControlPlaneConfig fromEnv() {
        ControlPlaneConfig config = new ControlPlaneConfig();

        String home = System.getenv("CLOUDFN_HOME");
        if (home != null && !home.isBlank()) {
            config.baseDir = Paths.get(home);
        }

        String host = System.getenv("CLOUDFN_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("CLOUDFN_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String mode = System.getenv("CLOUDFN_WORKER_MODE");
        if (mode != null && !mode.isBlank()) {
            config.workerLaunchMode = WorkerLaunchMode.valueOf(mode.trim().toUpperCase());
        }

        String poolSize = System.getenv("CLOUDFN_WORKER_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.workerPoolSize = Integer.parseInt(poolSize);
        }

        String ready = System.getenv("CLOUDFN_READY_TIMEOUT_SECONDS");
        if (ready != null && !ready.isBlank()) {
            config.workerReadyTimeout = Duration.ofSeconds(Long.parseLong(ready));
        }

        String execution = System.getenv("CLOUDFN_EXECUTION_TIMEOUT_SECONDS");
        if (execution != null && !execution.isBlank()) {
            long seconds = Long.parseLong(execution);
            config.executionTimeout = seconds > 0 ? Duration.ofSeconds(seconds) : null;
        }

        String taskWorkers = System.getenv("CLOUDFN_TASK_WORKERS");
        if (taskWorkers != null && !taskWorkers.isBlank()) {
            config.taskWorkers = Integer.parseInt(taskWorkers);
        }

        String retention = System.getenv("CLOUDFN_TASK_RETENTION_DAYS");
        if (retention != null && !retention.isBlank()) {
            config.taskRetentionDays = Integer.parseInt(retention);
        }

        String jvmOpts = System.getenv("CLOUDFN_WORKER_JVM_OPTS");
        if (jvmOpts != null && !jvmOpts.isBlank()) {
            config.workerJvmOptions = new ArrayList<>(Arrays.asList(jvmOpts.trim().split("\\s+")));
        }

        return config;
    }

    // Getters
    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public boolean apiEnabled() {
        return apiEnabled;
    }

    public Path baseDir() {
        return baseDir;
    }

    public Path projectsDir() {
        return projectsDir != null ? projectsDir : baseDir.resolve("projects");
    }

    public Path envsDir() {
        return envsDir != null ? envsDir : baseDir.resolve("envs");
    }

    public Path tasksDir() {
        return tasksDir != null ? tasksDir : baseDir.resolve("tasks");
    }

    /**
     * Worker stderr goes to {@code <logsDir>/projects/<project>.log} unless
     * {@link #inheritWorkerOutput()} is set.
     */
    public Path logsDir() {
        return logsDir != null ? logsDir : baseDir.resolve("logs");
    }

    public Path scheduleFile() {
        return scheduleFile != null ? scheduleFile : baseDir.resolve("config").resolve("scheduler.yaml");
    }

    public Path systemEnvFile() {
        return systemEnvFile != null ? systemEnvFile : baseDir.resolve(".env");
    }

    public Path systemDependencies() {
        return systemDependencies != null ? systemDependencies : baseDir.resolve("dependencies.txt");
    }

    public WorkerLaunchMode workerLaunchMode() {
        return workerLaunchMode;
    }

    public int workerPoolSize() {
        return workerPoolSize;
    }

    public Duration workerReadyTimeout() {
        return workerReadyTimeout;
    }

    public Duration terminateTimeout() {
        return terminateTimeout;
    }

    /**
     * Null when executions may run for as long as the worker stays alive.
     */
    public Duration executionTimeout() {
        return executionTimeout;
    }

    public Duration responsePollInterval() {
        return responsePollInterval;
    }

    public int channelCapacity() {
        return channelCapacity;
    }

    public List<String> workerJvmOptions() {
        return List.copyOf(workerJvmOptions);
    }

    public String workerClasspath() {
        return workerClasspath != null ? workerClasspath : System.getProperty("java.class.path");
    }

    public boolean inheritWorkerOutput() {
        return inheritWorkerOutput;
    }

    public Duration apiReadyTimeout() {
        return apiReadyTimeout;
    }

    public int taskWorkers() {
        return taskWorkers;
    }

    public int taskRetentionDays() {
        return taskRetentionDays;
    }

    public Duration taskSweepInterval() {
        return taskSweepInterval;
    }

    public ZoneId scheduleZone() {
        return scheduleZone;
    }

    // Fluent setters for testing/customization
    public ControlPlaneConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public ControlPlaneConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ControlPlaneConfig withApiEnabled(boolean enabled) {
        this.apiEnabled = enabled;
        return this;
    }

    public ControlPlaneConfig withBaseDir(Path dir) {
        this.baseDir = dir;
        return this;
    }

    public ControlPlaneConfig withProjectsDir(Path dir) {
        this.projectsDir = dir;
        return this;
    }

    public ControlPlaneConfig withEnvsDir(Path dir) {
        this.envsDir = dir;
        return this;
    }

    public ControlPlaneConfig withTasksDir(Path dir) {
        this.tasksDir = dir;
        return this;
    }

    public ControlPlaneConfig withLogsDir(Path dir) {
        this.logsDir = dir;
        return this;
    }

    public ControlPlaneConfig withScheduleFile(Path file) {
        this.scheduleFile = file;
        return this;
    }

    public ControlPlaneConfig withSystemEnvFile(Path file) {
        this.systemEnvFile = file;
        return this;
    }

    public ControlPlaneConfig withSystemDependencies(Path file) {
        this.systemDependencies = file;
        return this;
    }

    public ControlPlaneConfig withWorkerLaunchMode(WorkerLaunchMode mode) {
        this.workerLaunchMode = mode;
        return this;
    }

    public ControlPlaneConfig withWorkerPoolSize(int size) {
        this.workerPoolSize = size;
        return this;
    }

    public ControlPlaneConfig withWorkerReadyTimeout(Duration timeout) {
        this.workerReadyTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withTerminateTimeout(Duration timeout) {
        this.terminateTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withExecutionTimeout(Duration timeout) {
        this.executionTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withResponsePollInterval(Duration interval) {
        this.responsePollInterval = interval;
        return this;
    }

    public ControlPlaneConfig withChannelCapacity(int capacity) {
        this.channelCapacity = capacity;
        return this;
    }

    public ControlPlaneConfig withWorkerJvmOptions(List<String> options) {
        this.workerJvmOptions = new ArrayList<>(options);
        return this;
    }

    public ControlPlaneConfig withWorkerClasspath(String classpath) {
        this.workerClasspath = classpath;
        return this;
    }

    public ControlPlaneConfig withInheritWorkerOutput(boolean inherit) {
        this.inheritWorkerOutput = inherit;
        return this;
    }

    public ControlPlaneConfig withApiReadyTimeout(Duration timeout) {
        this.apiReadyTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withTaskWorkers(int workers) {
        this.taskWorkers = workers;
        return this;
    }

    public ControlPlaneConfig withTaskRetentionDays(int days) {
        this.taskRetentionDays = days;
        return this;
    }

    public ControlPlaneConfig withTaskSweepInterval(Duration interval) {
        this.taskSweepInterval = interval;
        return this;
    }

    public ControlPlaneConfig withScheduleZone(ZoneId zone) {
        this.scheduleZone = zone;
        return this;
    }

    @Override
    public String toString() {
        return "ControlPlaneConfig{" +
                "baseDir=" + baseDir +
                ", server=" + serverHost + ":" + serverPort +
                ", apiEnabled=" + apiEnabled +
                ", workerMode=" + workerLaunchMode +
                ", workerPoolSize=" + workerPoolSize +
                ", executionTimeout=" + (executionTimeout == null ? "none" : executionTimeout) +
                ", taskWorkers=" + taskWorkers +
                ", taskRetentionDays=" + taskRetentionDays +
                '}';
    }
}
