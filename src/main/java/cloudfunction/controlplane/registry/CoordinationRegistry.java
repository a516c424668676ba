package cloudfunction.controlplane.registry;

import cloudfunction.common.NamedThreadFactory;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Shared coordination context of the control plane.
 *
 * <p>Holds the fixed component slots, the per-project channels and readiness signals,
 * per-task completion signals, the worker handles and the per-project executors used
 * by in-process workers. One instance is built at startup and passed to every component.
 */
public final class CoordinationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CoordinationRegistry.class);

    private final ControlPlaneConfig config;
    private final WorkerLauncher launcher;

    private final Map<ComponentName, Object> components = new EnumMap<>(ComponentName.class);
    private final Map<String, MessageChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, ReadySignal> readySignals = new ConcurrentHashMap<>();
    private final Map<String, ReadySignal> taskSignals = new ConcurrentHashMap<>();
    private final Map<String, WorkerHandle> workers = new ConcurrentHashMap<>();
    private final Map<String, ExecutorService> executors = new ConcurrentHashMap<>();
    private final Map<String, Object> projectLocks = new ConcurrentHashMap<>();

    public CoordinationRegistry(ControlPlaneConfig config, Function<CoordinationRegistry, WorkerLauncher> launcherFactory) {
        this.config = config;
        this.launcher = launcherFactory.apply(this);
        components.put(ComponentName.REGISTRY, this);
    }

    public ControlPlaneConfig config() {
        return config;
    }

    // ==================== Component slots ====================

    /**
     * @throws cloudfunction.common.ConfigurationException if the name is not a known slot
     */
    public void register(String name, Object component) {
        register(ComponentName.fromName(name), component);
    }

    public synchronized void register(ComponentName name, Object component) {
        components.put(name, component);
        log.debug("Registered component {}", name.slotName());
    }

    /**
     * @throws cloudfunction.common.ConfigurationException if the name is not a known slot
     */
    public Optional<Object> get(String name) {
        return get(ComponentName.fromName(name));
    }

    public synchronized Optional<Object> get(ComponentName name) {
        return Optional.ofNullable(components.get(name));
    }

    public <T> Optional<T> get(ComponentName name, Class<T> type) {
        return get(name).filter(type::isInstance).map(type::cast);
    }

    // ==================== IPC primitives ====================

    public MessageChannel channel(String project) {
        return channels.computeIfAbsent(project,
                p -> new MessageChannel(p, config.channelCapacity(), readySignal(p)));
    }

    public ReadySignal readySignal(String project) {
        return readySignals.computeIfAbsent(project, p -> new ReadySignal());
    }

    /**
     * Completion signal of a task, fired when it reaches a terminal state.
     */
    public ReadySignal taskSignal(String taskId) {
        return taskSignals.computeIfAbsent(taskId, id -> new ReadySignal());
    }

    public Optional<ReadySignal> existingTaskSignal(String taskId) {
        return Optional.ofNullable(taskSignals.get(taskId));
    }

    /**
     * Executor for synchronous dispatch inside an in-process worker, created on first use.
     */
    public ExecutorService executorFor(String project) {
        return executors.computeIfAbsent(project, p -> Executors.newFixedThreadPool(
                Math.max(1, config.workerPoolSize()), new NamedThreadFactory("fn-" + p + "-")));
    }

    // ==================== Worker lifecycle ====================

    /**
     * Starts the worker of a project. A live or still-starting worker is left alone;
     * a dead one is cleaned up first. Never throws.
     *
     * @return true if a worker is (now) running
     */
    public boolean startProjectProcess(String project) {
        synchronized (lockFor(project)) {
            WorkerHandle existing = workers.get(project);
            if (existing != null) {
                if (existing.process().isAlive()) {
                    log.debug("Worker for project {} already running", project);
                    return true;
                }
                log.warn("Worker for project {} is dead, cleaning up before restart", project);
                cleanupProject(project);
            }
            try {
                MessageChannel channel = channel(project);
                ManagedProcess process = launcher.launch(project, channel);
                workers.put(project, new WorkerHandle(project, process, channel, Instant.now()));
                log.info("Started worker for project {} ({})", project, process);
                return true;
            } catch (Exception e) {
                log.error("Failed to start worker for project {}: {}", project, e.getMessage(), e);
                cleanupProject(project);
                return false;
            }
        }
    }

    /**
     * Stops the worker of a project: sends {@code stop}, waits, then force-kills.
     * Bookkeeping is always released. Unknown projects are a no-op.
     */
    public boolean terminateProcess(String project) {
        synchronized (lockFor(project)) {
            WorkerHandle handle = workers.get(project);
            if (handle == null) {
                log.debug("No worker for project {} to terminate", project);
                cleanupProject(project);
                return true;
            }
            ManagedProcess process = handle.process();
            try {
                if (process.isAlive()) {
                    try {
                        handle.channel().send(WorkerMessage.stop());
                    } catch (IOException e) {
                        log.debug("Could not send stop to project {}: {}", project, e.getMessage());
                    }
                    if (!process.waitFor(config.terminateTimeout())) {
                        log.warn("Worker for project {} did not stop in {}, killing", project, config.terminateTimeout());
                        process.destroyForcibly();
                        process.waitFor(config.terminateTimeout());
                    }
                }
                log.info("Terminated worker for project {}", project);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            } finally {
                cleanupProject(project);
            }
            return true;
        }
    }

    /**
     * @return true if the project's worker is alive and has signalled readiness
     */
    public boolean checkProcessStatus(String project) {
        WorkerHandle handle = workers.get(project);
        return handle != null && handle.isLive();
    }

    /**
     * Waits for the project's readiness signal, giving up early if the worker dies.
     */
    public boolean waitForReady(String project, Duration timeout) {
        WorkerHandle handle = workers.get(project);
        if (handle == null) {
            return false;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        Duration slice = config.responsePollInterval();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return handle.isLive();
                }
                Duration wait = Duration.ofNanos(Math.min(remaining, slice.toNanos()));
                if (handle.readySignal().await(wait)) {
                    return handle.process().isAlive();
                }
                if (!handle.process().isAlive()) {
                    log.warn("Worker for project {} exited before becoming ready", project);
                    return false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public Optional<WorkerHandle> workerHandle(String project) {
        return Optional.ofNullable(workers.get(project));
    }

    public Set<String> managedProjects() {
        return new TreeSet<>(workers.keySet());
    }

    // ==================== Cleanup ====================

    /**
     * Releases everything held for a project. Safe to call repeatedly.
     */
    public void cleanupProject(String project) {
        WorkerHandle handle = workers.remove(project);
        if (handle != null && handle.process().isAlive()) {
            log.warn("Releasing worker for project {} that is still alive, killing it", project);
            handle.process().destroyForcibly();
        }
        MessageChannel channel = channels.remove(project);
        if (channel != null) {
            channel.close();
        }
        readySignals.remove(project);
        ExecutorService executor = executors.remove(project);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Releases the completion signal of a task, firing it first so waiters wake up.
     */
    public void cleanupTaskResources(String taskId) {
        ReadySignal signal = taskSignals.remove(taskId);
        if (signal != null) {
            signal.signal();
        }
    }

    /**
     * Full teardown: workers, channels and signals, executors, registered components,
     * then the launcher. Each step is attempted even if an earlier one failed.
     */
    public void cleanupResources() {
        log.info("Releasing coordination resources...");

        for (String project : new ArrayList<>(workers.keySet())) {
            try {
                terminateProcess(project);
            } catch (Exception e) {
                log.warn("Error terminating worker for project {}: {}", project, e.getMessage());
            }
        }

        try {
            for (MessageChannel channel : channels.values()) {
                int dropped = channel.drain().size();
                if (dropped > 0) {
                    log.debug("Dropped {} pending replies on channel {}", dropped, channel.name());
                }
                channel.close();
            }
            channels.clear();
            readySignals.clear();
            taskSignals.values().forEach(ReadySignal::signal);
            taskSignals.clear();
        } catch (Exception e) {
            log.warn("Error releasing channels: {}", e.getMessage());
        }

        for (Map.Entry<String, ExecutorService> entry : executors.entrySet()) {
            try {
                entry.getValue().shutdownNow();
            } catch (Exception e) {
                log.warn("Error shutting down executor for project {}: {}", entry.getKey(), e.getMessage());
            }
        }
        executors.clear();

        List<Map.Entry<ComponentName, Object>> registered;
        synchronized (this) {
            registered = new ArrayList<>(components.entrySet());
            components.clear();
            components.put(ComponentName.REGISTRY, this);
        }
        for (Map.Entry<ComponentName, Object> entry : registered) {
            if (entry.getKey() == ComponentName.REGISTRY || !(entry.getValue() instanceof AutoCloseable closeable)) {
                continue;
            }
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing component {}: {}", entry.getKey().slotName(), e.getMessage());
            }
        }

        try {
            launcher.close();
        } catch (Exception e) {
            log.warn("Error closing worker launcher: {}", e.getMessage());
        }

        log.info("Coordination resources released");
    }

    private Object lockFor(String project) {
        return projectLocks.computeIfAbsent(project, p -> new Object());
    }
}
