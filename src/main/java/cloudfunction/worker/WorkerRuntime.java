package cloudfunction.worker;

import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.Jsons;
import cloudfunction.environment.EnvironmentHandle;
import cloudfunction.environment.EnvironmentProvisioner;
import cloudfunction.environment.ProjectEnvironment;
import cloudfunction.protocol.MessageSink;
import cloudfunction.protocol.MessageType;
import cloudfunction.protocol.WorkerMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The worker side of a project: initializes the project, then serves execute commands
 * from a single inbound queue until {@code stop} arrives.
 *
 * <p>Used both by {@link WorkerMain} in a child JVM (queue fed from stdin) and by the
 * in-process launcher (queue fed directly by the control plane).
 */
public final class WorkerRuntime implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final String project;
    private final Path projectDir;
    private final Path systemEnvFile;
    private final EnvironmentProvisioner provisioner;
    private final HandlerResolver resolver;
    private final BlockingQueue<WorkerMessage> inbound;
    private final MessageSink outbound;
    private final ExecutorService pool;
    private final Duration pollInterval;
    private final InvocationLog invocations = new InvocationLog();

    private volatile FunctionRegistry functions;
    private volatile Throwable initError;
    private volatile boolean initialized;
    private URLClassLoader classLoader;

    public WorkerRuntime(String project,
            Path projectDir,
            Path systemEnvFile,
            EnvironmentProvisioner provisioner,
            HandlerResolver resolver,
            BlockingQueue<WorkerMessage> inbound,
            MessageSink outbound,
            ExecutorService pool,
            Duration pollInterval) {
        this.project = project;
        this.projectDir = projectDir;
        this.systemEnvFile = systemEnvFile;
        this.provisioner = provisioner;
        this.resolver = resolver;
        this.inbound = inbound;
        this.outbound = outbound;
        this.pool = pool;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        initialize();
        try {
            serve();
        } finally {
            closeClassLoader();
            log.info("Worker for project {} exiting", project);
        }
    }

    /**
     * Prepares the environment and loads the project's functions. Failures are
     * recorded; readiness is signalled in every case.
     */
    void initialize() {
        try {
            EnvironmentHandle handle = provisioner.ensureEnvironment(project);
            provisioner.installDependencies(project, handle);
            Map<String, String> env = ProjectEnvironment.load(systemEnvFile, projectDir);
            classLoader = ProjectClassLoader.create(project, projectDir, handle.libDir(),
                    WorkerRuntime.class.getClassLoader());
            FunctionRegistry registry = new FunctionRegistry(project, resolver, classLoader, env);
            int registered = registry.scan(projectDir);
            int loaded = registry.loadAll();
            functions = registry;
            initialized = true;
            log.info("Worker for project {} initialized: {} functions registered, {} loaded",
                    project, registered, loaded);
        } catch (IOException | RuntimeException e) {
            initError = e;
            log.error("Worker for project {} failed to initialize: {}", project, e.getMessage(), e);
        } finally {
            sendQuietly(WorkerMessage.ready());
        }
    }

    private void serve() {
        while (!Thread.currentThread().isInterrupted()) {
            WorkerMessage message;
            try {
                message = inbound.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message.isStop()) {
                log.debug("Worker for project {} received stop", project);
                break;
            }
            if (message.type() != MessageType.EXECUTE) {
                log.warn("Worker for project {} ignoring {} message", project, message.type());
                continue;
            }
            if (execute(message)) {
                break;
            }
        }
    }

    /**
     * Handles one execute command.
     *
     * @return true if a stop command arrived while the function was running
     */
    boolean execute(WorkerMessage message) {
        String requestId = message.requestId();
        String name = message.functionName();
        if (!initialized) {
            String cause = initError == null ? "unknown error" : initError.getMessage();
            reply(WorkerMessage.error(requestId, "Worker for project " + project + " is not initialized: " + cause));
            return false;
        }
        if (name == null || functions.get(name).isEmpty()) {
            reply(WorkerMessage.error(requestId, "Function " + name + " not found in project " + project));
            return false;
        }

        FunctionHandler handler;
        try {
            handler = functions.ensureLoaded(name);
        } catch (FunctionLoadException e) {
            reply(WorkerMessage.error(requestId, "Function " + name + " failed to load: " + e.getMessage()));
            return false;
        }

        JsonNode payload = message.payload() == null ? NullNode.getInstance() : message.payload();
        invocations.started(requestId, name);
        Future<?> future;
        try {
            if (handler.isAsync()) {
                Object stage = handler.invoke(payload);
                if (!(stage instanceof CompletionStage<?> cs)) {
                    throw new IllegalStateException("Asynchronous function " + name + " returned " + stage);
                }
                future = cs.toCompletableFuture();
            } else {
                future = pool.submit(() -> handler.invoke(payload));
            }
        } catch (RejectedExecutionException e) {
            finish(requestId, WorkerMessage.error(requestId, "Worker for project " + project + " is shutting down"));
            return true;
        } catch (Exception e) {
            finish(requestId, WorkerMessage.error(requestId, describe(e)));
            return false;
        }
        return await(requestId, name, future);
    }

    private boolean await(String requestId, String name, Future<?> future) {
        long pollMillis = Math.max(1, pollInterval.toMillis());
        while (true) {
            try {
                Object value = future.get(pollMillis, TimeUnit.MILLISECONDS);
                JsonNode result;
                try {
                    result = toJson(value);
                } catch (IllegalArgumentException e) {
                    finish(requestId, WorkerMessage.error(requestId,
                            "Result of " + name + " is not serializable: " + e.getMessage()));
                    return false;
                }
                finish(requestId, WorkerMessage.success(requestId, result));
                return false;
            } catch (TimeoutException e) {
                WorkerMessage next = inbound.peek();
                if (next != null && next.isStop()) {
                    inbound.poll();
                    future.cancel(true);
                    log.warn("Stop received while function {} of project {} was running", name, project);
                    finish(requestId, WorkerMessage.error(requestId,
                            "Worker for project " + project + " stopped while running " + name));
                    return true;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.debug("Function {} of project {} failed", name, project, cause);
                finish(requestId, WorkerMessage.error(requestId, describe(cause)));
                return false;
            } catch (CancellationException e) {
                finish(requestId, WorkerMessage.error(requestId, "Function " + name + " was cancelled"));
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                finish(requestId, WorkerMessage.error(requestId,
                        "Worker for project " + project + " interrupted while running " + name));
                return true;
            }
        }
    }

    private void finish(String requestId, WorkerMessage reply) {
        invocations.finished(requestId, reply.status());
        reply(reply);
    }

    private JsonNode toJson(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return Jsons.mapper().valueToTree(value);
    }

    private void reply(WorkerMessage message) {
        sendQuietly(message);
    }

    private void sendQuietly(WorkerMessage message) {
        try {
            outbound.send(message);
        } catch (IOException e) {
            log.warn("Worker for project {} could not send {}: {}", project, message.type(), e.getMessage());
        }
    }

    private void closeClassLoader() {
        if (classLoader == null) {
            return;
        }
        try {
            classLoader.close();
        } catch (IOException e) {
            log.debug("Failed to close class loader for project {}: {}", project, e.getMessage());
        }
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + message;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public InvocationLog invocations() {
        return invocations;
    }
}
