package cloudfunction.controlplane.core;

import cloudfunction.common.CloudFunctionException;
import cloudfunction.common.FunctionExecutionException;
import cloudfunction.common.FunctionTimeoutException;
import cloudfunction.common.Names;
import cloudfunction.common.ProjectNotFoundException;
import cloudfunction.common.ProjectUnavailableException;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.project.FunctionCatalog;
import cloudfunction.controlplane.registry.ComponentName;
import cloudfunction.controlplane.registry.CoordinationRegistry;
import cloudfunction.controlplane.registry.WorkerHandle;
import cloudfunction.protocol.WorkerMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts and stops the control plane and routes synchronous invocations to project workers.
 *
 * <p>Invocations on one project are serialized: one execute command is in flight per
 * worker channel at any time, later callers queue in arrival order. A dead worker is
 * restarted at most once per call.
 */
public final class Master implements FunctionInvoker {

    private static final Logger log = LoggerFactory.getLogger(Master.class);

    private final CoordinationRegistry registry;
    private final FunctionCatalog catalog;
    private final ControlPlaneConfig config;
    private final Map<String, ReentrantLock> invocationLocks = new ConcurrentHashMap<>();
    private final AtomicReference<MasterState> state = new AtomicReference<>(MasterState.NEW);

    public Master(CoordinationRegistry registry, FunctionCatalog catalog, ControlPlaneConfig config) {
        this.registry = registry;
        this.catalog = catalog;
        this.config = config;
    }

    public MasterState state() {
        return state.get();
    }

    /**
     * Starts the API layer (if one is registered) and the worker of every discovered project.
     * Project failures are collected in the report; an API layer that does not become
     * ready aborts startup.
     */
    public StartupReport start() {
        if (!state.compareAndSet(MasterState.NEW, MasterState.INITIALIZING)) {
            throw new IllegalStateException("Master cannot start from state " + state.get());
        }
        log.info("Starting master with config: {}", config);

        Optional<ApiLayer> api = registry.get(ComponentName.API_SERVER, ApiLayer.class);
        if (api.isPresent()) {
            try {
                api.get().start();
                if (!awaitApiReady(api.get())) {
                    throw new CloudFunctionException("API layer not ready within " + config.apiReadyTimeout());
                }
            } catch (Exception e) {
                log.error("API layer failed to start, aborting startup: {}", e.getMessage(), e);
                stop();
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                throw e instanceof CloudFunctionException cfe
                        ? cfe
                        : new CloudFunctionException("API layer failed to start: " + e.getMessage(), e);
            }
        }

        List<String> started = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        List<String> projects = catalog.listProjectNames();
        for (String project : projects) {
            try {
                if (!registry.startProjectProcess(project)) {
                    failed.put(project, "worker could not be launched");
                } else if (!registry.waitForReady(project, config.workerReadyTimeout())) {
                    failed.put(project, "worker not ready within " + config.workerReadyTimeout());
                } else {
                    started.add(project);
                }
            } catch (Exception e) {
                failed.put(project, e.getMessage());
            }
        }
        if (!failed.isEmpty()) {
            log.warn("{} of {} projects failed to start: {}", failed.size(), projects.size(), failed);
        }

        state.set(MasterState.RUNNING);
        log.info("Master running, {} project workers ready", started.size());
        return new StartupReport(started, failed);
    }

    /**
     * Stops every worker, the API layer and releases all registry resources.
     * Each step runs even if an earlier one failed.
     */
    public void stop() {
        MasterState previous = state.getAndSet(MasterState.STOPPING);
        if (previous == MasterState.STOPPED || previous == MasterState.STOPPING) {
            state.set(previous);
            return;
        }
        log.info("Stopping master...");

        for (String project : registry.managedProjects()) {
            try {
                registry.terminateProcess(project);
            } catch (Exception e) {
                log.warn("Error terminating project {}: {}", project, e.getMessage());
            }
        }

        try {
            registry.get(ComponentName.API_SERVER, ApiLayer.class).ifPresent(ApiLayer::stop);
        } catch (Exception e) {
            log.warn("Error stopping API layer: {}", e.getMessage());
        }

        try {
            registry.cleanupResources();
        } catch (Exception e) {
            log.warn("Error releasing registry resources: {}", e.getMessage());
        }

        state.set(MasterState.STOPPED);
        log.info("Master stopped");
    }

    @Override
    public JsonNode executeFunction(String project, String function, JsonNode payload) {
        Names.requireValid("project", project);
        Names.requireValid("function", function);
        if (!catalog.projectExists(project)) {
            throw new ProjectNotFoundException(project);
        }

        ReentrantLock lock = invocationLocks.computeIfAbsent(project, p -> new ReentrantLock(true));
        lock.lock();
        try {
            WorkerHandle handle = ensureLiveWorker(project);
            String requestId = UUID.randomUUID().toString();

            List<WorkerMessage> stale = handle.channel().drain();
            if (!stale.isEmpty()) {
                log.debug("Discarded {} stale replies for project {}", stale.size(), project);
            }
            try {
                handle.channel().send(WorkerMessage.execute(requestId, function, payload));
            } catch (IOException e) {
                throw new ProjectUnavailableException(project, "failed to send command: " + e.getMessage(), e);
            }

            WorkerMessage reply = awaitReply(project, function, handle, requestId);
            if (reply.isSuccess()) {
                return reply.result() == null ? NullNode.getInstance() : reply.result();
            }
            String error = reply.error() == null ? "unknown error" : reply.error();
            log.debug("Function {} of project {} failed: {}", function, project, error);
            throw new FunctionExecutionException(project, function, error);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminates and restarts a project's worker, waiting for readiness.
     */
    public boolean restartProject(String project) {
        log.info("Restarting project {}", project);
        registry.terminateProcess(project);
        if (!catalog.projectExists(project)) {
            return false;
        }
        return registry.startProjectProcess(project)
                && registry.waitForReady(project, config.workerReadyTimeout());
    }

    /**
     * Terminates a project's worker without restarting it.
     */
    public void stopProject(String project) {
        registry.terminateProcess(project);
    }

    private WorkerHandle ensureLiveWorker(String project) {
        Optional<WorkerHandle> current = registry.workerHandle(project);
        if (current.isPresent() && current.get().isLive()) {
            return current.get();
        }
        if (current.isPresent() && current.get().process().isAlive()) {
            // still starting
            if (registry.waitForReady(project, config.workerReadyTimeout())) {
                return current.get();
            }
            log.warn("Worker for project {} never became ready, replacing it", project);
            registry.terminateProcess(project);
        } else if (current.isPresent()) {
            log.warn("Worker for project {} is dead, restarting", project);
        } else {
            log.info("No worker for project {}, starting one", project);
        }

        if (!registry.startProjectProcess(project)) {
            throw new ProjectUnavailableException(project, "worker could not be started");
        }
        if (!registry.waitForReady(project, config.workerReadyTimeout())) {
            registry.terminateProcess(project);
            throw new ProjectUnavailableException(project, "worker not ready within " + config.workerReadyTimeout());
        }
        return registry.workerHandle(project)
                .filter(WorkerHandle::isLive)
                .orElseThrow(() -> new ProjectUnavailableException(project, "worker died during startup"));
    }

    private WorkerMessage awaitReply(String project, String function, WorkerHandle handle, String requestId) {
        Duration poll = config.responsePollInterval();
        Duration timeout = config.executionTimeout();
        long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        while (true) {
            Duration wait = poll;
            if (timeout != null) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("Function {} of project {} timed out after {}", function, project, timeout);
                    throw new FunctionTimeoutException(project, function, timeout);
                }
                wait = Duration.ofNanos(Math.min(remaining, poll.toNanos()));
            }

            Optional<WorkerMessage> message;
            try {
                message = handle.channel().receive(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProjectUnavailableException(project, "interrupted while waiting for " + function, e);
            }

            if (message.isPresent()) {
                if (requestId.equals(message.get().requestId())) {
                    return message.get();
                }
                log.debug("Discarding stale reply {} for project {}", message.get().requestId(), project);
                continue;
            }
            if (!handle.process().isAlive()) {
                log.warn("Worker for project {} died while running {}", project, function);
                throw new ProjectUnavailableException(project, "worker died while running " + function);
            }
        }
    }

    private boolean awaitApiReady(ApiLayer api) throws InterruptedException {
        long deadline = System.nanoTime() + config.apiReadyTimeout().toNanos();
        while (!api.isReady()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(50);
        }
        return true;
    }
}
