package cloudfunction.controlplane.config;

import cloudfunction.controlplane.api.v1.FunctionController;
import cloudfunction.controlplane.api.v1.HealthController;
import cloudfunction.controlplane.api.v1.ProjectController;
import cloudfunction.controlplane.api.v1.TaskController;
import cloudfunction.controlplane.core.Master;
import cloudfunction.controlplane.core.StartupReport;
import cloudfunction.controlplane.project.FunctionCatalog;
import cloudfunction.controlplane.project.ProjectManager;
import cloudfunction.controlplane.registry.ComponentName;
import cloudfunction.controlplane.registry.CoordinationRegistry;
import cloudfunction.controlplane.registry.InProcessWorkerLauncher;
import cloudfunction.controlplane.registry.ProcessWorkerLauncher;
import cloudfunction.controlplane.server.ApiServer;
import cloudfunction.controlplane.server.RouterHandler;
import cloudfunction.controlplane.service.TaskManager;
import cloudfunction.controlplane.store.FileTaskStore;
import cloudfunction.controlplane.store.TaskStore;
import cloudfunction.environment.DirectoryEnvironmentProvisioner;
import cloudfunction.environment.EnvironmentProvisioner;
import cloudfunction.worker.ClassHandlerResolver;
import cloudfunction.worker.HandlerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Manual dependency injection container.
 * Creates and wires all components and registers them in the coordination registry.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ControlPlaneConfig.fromEnv());
 * deps.start(); // API server, project workers, scheduled jobs
 * deps.master().executeFunction("demo", "echo", payload);
 * deps.close(); // stops everything
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ControlPlaneConfig config;
    private final EnvironmentProvisioner provisioner;
    private final HandlerResolver resolver;
    private final CoordinationRegistry registry;
    private final FunctionCatalog catalog;
    private final Master master;
    private final ProjectManager projectManager;
    private final TaskStore taskStore;
    private final TaskManager taskManager;
    private final ApiServer apiServer;

    private Dependencies(ControlPlaneConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Worker-side collaborators
        this.provisioner = new DirectoryEnvironmentProvisioner(
                config.projectsDir(), config.envsDir(), config.systemDependencies());
        this.resolver = new ClassHandlerResolver();

        // Coordination
        this.registry = new CoordinationRegistry(config, reg ->
                config.workerLaunchMode() == WorkerLaunchMode.IN_PROCESS
                        ? new InProcessWorkerLauncher(config, provisioner, resolver, reg::executorFor)
                        : new ProcessWorkerLauncher(config));

        // Services
        this.catalog = new FunctionCatalog(config, resolver);
        this.master = new Master(registry, catalog, config);
        this.projectManager = new ProjectManager(config, catalog, resolver, provisioner, master);
        this.taskStore = new FileTaskStore(config.tasksDir());
        this.taskManager = new TaskManager(taskStore, registry, config);

        registry.register(ComponentName.MASTER, master);
        registry.register(ComponentName.PROJECT_MANAGER, projectManager);
        registry.register(ComponentName.TASK_MANAGER, taskManager);

        // HTTP API
        if (config.apiEnabled()) {
            RouterHandler router = new RouterHandler()
                    .registerController(new HealthController(master, taskManager, registry))
                    .registerController(new FunctionController(master))
                    .registerController(new ProjectController(catalog, projectManager))
                    .registerController(new TaskController(taskManager));
            this.apiServer = new ApiServer(config, router);
            registry.register(ComponentName.API_SERVER, apiServer);
            log.info("RouterHandler created with {} controllers", router.controllerCount());
        } else {
            this.apiServer = null;
        }

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(ControlPlaneConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ControlPlaneConfig.fromEnv());
    }

    /**
     * Starts the master (API layer and project workers), then the task manager.
     */
    public StartupReport start() {
        StartupReport report = master.start();
        taskManager.start();
        return report;
    }

    // Getters
    public ControlPlaneConfig config() {
        return config;
    }

    public EnvironmentProvisioner provisioner() {
        return provisioner;
    }

    public HandlerResolver resolver() {
        return resolver;
    }

    public CoordinationRegistry registry() {
        return registry;
    }

    public FunctionCatalog catalog() {
        return catalog;
    }

    public Master master() {
        return master;
    }

    public ProjectManager projectManager() {
        return projectManager;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public TaskManager taskManager() {
        return taskManager;
    }

    public Optional<ApiServer> apiServer() {
        return Optional.ofNullable(apiServer);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            master.stop();
        } catch (Exception e) {
            log.warn("Error stopping master: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
