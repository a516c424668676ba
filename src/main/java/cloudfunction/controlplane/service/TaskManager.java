package cloudfunction.controlplane.service;

import cloudfunction.common.CloudFunctionException;
import cloudfunction.common.FunctionExecutionException;
import cloudfunction.common.NamedThreadFactory;
import cloudfunction.common.Names;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.core.FunctionInvoker;
import cloudfunction.controlplane.model.ScheduledJob;
import cloudfunction.controlplane.model.Task;
import cloudfunction.controlplane.model.TaskStatus;
import cloudfunction.controlplane.registry.ComponentName;
import cloudfunction.controlplane.registry.CoordinationRegistry;
import cloudfunction.controlplane.registry.ReadySignal;
import cloudfunction.controlplane.scheduler.ScheduleDefinitionLoader;
import cloudfunction.controlplane.scheduler.TaskScheduler;
import cloudfunction.controlplane.store.TaskStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous invocations: creates, runs, tracks, cancels and expires tasks.
 *
 * <p>At most one task is active (created or running) per {@code (project, function)};
 * creating another while one is active returns the active one. Active tasks are kept in
 * memory, every state change is persisted, terminal tasks are served from the store.
 *
 * <p>Executions of one project run one after another on a single pool thread, so a project
 * whose functions hang holds at most one task worker.
 */
public class TaskManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    static final String RESTART_ERROR = "interrupted by control plane restart";

    private final TaskStore store;
    private final CoordinationRegistry registry;
    private final ControlPlaneConfig config;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Map<String, Task> tasks = new LinkedHashMap<>(); // guarded by lock
    // project -> task ids waiting to run; a key is present while the project has a drain running
    private final Map<String, Deque<String>> queued = new HashMap<>(); // guarded by lock
    private final Object lock = new Object();

    private TaskScheduler scheduler;

    public TaskManager(TaskStore store, CoordinationRegistry registry, ControlPlaneConfig config) {
        this(store, registry, config, null);
    }

    /**
     * @param executor runs task executions; null for a bounded pool of {@code taskWorkers} threads
     */
    public TaskManager(TaskStore store, CoordinationRegistry registry, ControlPlaneConfig config, Executor executor) {
        this.store = store;
        this.registry = registry;
        this.config = config;
        if (executor == null) {
            this.ownedExecutor = Executors.newFixedThreadPool(Math.max(1, config.taskWorkers()),
                    new NamedThreadFactory("task-worker-"));
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
    }

    /**
     * Recovers tasks interrupted by a previous run, then starts cron jobs and the sweeper.
     */
    public synchronized void start() {
        if (scheduler != null) {
            log.warn("Task manager already started");
            return;
        }
        int recovered = recoverInterruptedTasks();
        if (recovered > 0) {
            log.warn("Marked {} tasks from a previous run as failed", recovered);
        }
        List<ScheduledJob> jobs = new ScheduleDefinitionLoader().load(config.scheduleFile(), config.projectsDir());
        scheduler = new TaskScheduler(this, config);
        scheduler.start(jobs);
        log.info("Task manager started");
    }

    public synchronized Optional<TaskScheduler> scheduler() {
        return Optional.ofNullable(scheduler);
    }

    /**
     * Creates a task and schedules its execution, or returns the active task for the same
     * project and function.
     */
    public Task createTask(String project, String function, JsonNode payload) {
        Names.requireValid("project", project);
        Names.requireValid("function", function);

        Task task;
        boolean startDrain;
        synchronized (lock) {
            Optional<Task> active = findActive(project, function);
            if (active.isPresent()) {
                log.info("Task {} already active for {}/{}, not creating another",
                        active.get().taskId(), project, function);
                return active.get();
            }
            Instant now = Instant.now();
            task = Task.builder()
                    .taskId(Task.newTaskId(project, function))
                    .projectName(project)
                    .functionName(function)
                    .payload(payload == null ? NullNode.getInstance() : payload)
                    .status(TaskStatus.CREATED)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            store.save(task);
            tasks.put(task.taskId(), task);
            registry.taskSignal(task.taskId());
            Deque<String> pending = queued.get(project);
            startDrain = pending == null;
            if (startDrain) {
                pending = new ArrayDeque<>();
                queued.put(project, pending);
            }
            pending.add(task.taskId());
        }
        log.info("Created task {}", task.taskId());

        if (startDrain) {
            try {
                executor.execute(() -> drain(project));
            } catch (RejectedExecutionException e) {
                log.error("Task executor rejected work for project {}", project);
                List<String> orphaned;
                synchronized (lock) {
                    Deque<String> pending = queued.remove(project);
                    orphaned = pending == null ? List.of() : new ArrayList<>(pending);
                }
                for (String id : orphaned) {
                    complete(id, null, "task executor is shut down");
                }
            }
        }
        return task;
    }

    /**
     * Runs the queued tasks of one project in order until none are left.
     */
    private void drain(String project) {
        while (true) {
            String next;
            synchronized (lock) {
                Deque<String> pending = queued.get(project);
                next = pending == null ? null : pending.poll();
                if (next == null) {
                    queued.remove(project);
                    return;
                }
            }
            executeTask(next);
        }
    }

    /**
     * Runs a created task to completion. Tasks cancelled before this point are skipped.
     */
    void executeTask(String taskId) {
        Task task;
        synchronized (lock) {
            task = tasks.get(taskId);
            if (task == null || task.status() != TaskStatus.CREATED) {
                log.debug("Task {} is no longer runnable, skipping", taskId);
                return;
            }
            try {
                task = transition(task, TaskStatus.RUNNING, null, null);
            } catch (RuntimeException e) {
                log.error("Failed to start task {}", taskId, e);
                tasks.remove(taskId);
                registry.cleanupTaskResources(taskId);
                return;
            }
        }

        JsonNode result = null;
        String error = null;
        try {
            FunctionInvoker invoker = registry.get(ComponentName.MASTER, FunctionInvoker.class)
                    .orElseThrow(() -> new CloudFunctionException("No master registered"));
            result = invoker.executeFunction(task.projectName(), task.functionName(), task.payload());
        } catch (FunctionExecutionException e) {
            error = e.getMessage();
        } catch (Exception e) {
            log.warn("Task {} failed: {}", taskId, e.getMessage());
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        } finally {
            complete(taskId, result, error);
        }
    }

    private void complete(String taskId, JsonNode result, String error) {
        try {
            synchronized (lock) {
                Task current = tasks.get(taskId);
                if (current == null) {
                    return;
                }
                if (current.status() == TaskStatus.CANCELLED) {
                    log.info("Task {} finished after being cancelled, keeping cancelled", taskId);
                    tasks.remove(taskId);
                    return;
                }
                Task done = error == null
                        ? transition(current, TaskStatus.COMPLETED, result == null ? NullNode.getInstance() : result, null)
                        : transition(current, TaskStatus.FAILED, null, error);
                tasks.remove(taskId);
                log.info("Task {} {}", taskId, done.status().wireName());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record completion of task {}", taskId, e);
        } finally {
            registry.cleanupTaskResources(taskId);
        }
    }

    /**
     * Looks in memory first, then in the store.
     */
    public Optional<Task> getTaskStatus(String taskId) {
        synchronized (lock) {
            Task task = tasks.get(taskId);
            if (task != null) {
                return Optional.of(task);
            }
        }
        return store.findById(taskId);
    }

    /**
     * Waits until the task reaches a terminal state or the timeout expires, then returns its current record.
     */
    public Optional<Task> awaitTask(String taskId, Duration timeout) throws InterruptedException {
        Optional<ReadySignal> signal = registry.existingTaskSignal(taskId);
        if (signal.isPresent()) {
            signal.get().await(timeout);
        }
        return getTaskStatus(taskId);
    }

    /**
     * Persisted tasks merged with in-memory ones, oldest first. Null filters match everything.
     */
    public List<Task> listTasks(String project, TaskStatus status) {
        Map<String, Task> merged = new LinkedHashMap<>();
        for (Task t : store.findAll()) {
            merged.put(t.taskId(), t);
        }
        synchronized (lock) {
            merged.putAll(tasks);
        }
        List<Task> result = new ArrayList<>();
        for (Task t : merged.values()) {
            if ((project == null || project.equals(t.projectName())) && (status == null || status == t.status())) {
                result.add(t);
            }
        }
        result.sort(Comparator.comparing(Task::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return result;
    }

    /**
     * Cancels a created or running task. A running invocation is not interrupted;
     * its outcome is discarded.
     *
     * @return false if the task is unknown or already terminal
     */
    public boolean cancelTask(String taskId) {
        synchronized (lock) {
            Task task = tasks.get(taskId);
            if (task == null || !task.isActive()) {
                return false;
            }
            transition(task, TaskStatus.CANCELLED, null, null);
            if (task.status() == TaskStatus.CREATED) {
                // never started; nothing will complete it
                tasks.remove(taskId);
            }
            log.info("Cancelled task {} (was {})", taskId, task.status().wireName());
        }
        registry.cleanupTaskResources(taskId);
        return true;
    }

    /**
     * Deletes persisted tasks created more than {@code days} days ago. Active tasks are kept.
     *
     * @return number of records deleted
     */
    public int cleanupOldTasks(int days) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(days));
        Set<String> active;
        synchronized (lock) {
            active = new HashSet<>(tasks.keySet());
        }
        int removed = 0;
        for (Task t : store.findAll()) {
            if (active.contains(t.taskId()) || t.createdAt() == null || !t.createdAt().isBefore(cutoff)) {
                continue;
            }
            try {
                if (store.delete(t.taskId())) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to delete task {}: {}", t.taskId(), e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Removed {} tasks older than {} days", removed, days);
        }
        return removed;
    }

    /**
     * Marks persisted created/running tasks that this instance does not own as failed.
     *
     * @return number of tasks marked
     */
    public int recoverInterruptedTasks() {
        int recovered = 0;
        for (Task t : store.findAll()) {
            if (!t.isActive()) {
                continue;
            }
            synchronized (lock) {
                if (tasks.containsKey(t.taskId())) {
                    continue;
                }
                store.save(t.toBuilder()
                        .status(TaskStatus.FAILED)
                        .error(RESTART_ERROR)
                        .updatedAt(Instant.now())
                        .build());
            }
            recovered++;
        }
        return recovered;
    }

    public int activeTaskCount() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    @Override
    public void close() {
        TaskScheduler s;
        synchronized (this) {
            s = scheduler;
        }
        if (s != null) {
            s.stop();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Task manager closed");
    }

    private Optional<Task> findActive(String project, String function) {
        for (Task t : tasks.values()) {
            if (t.isActive() && t.isFor(project, function)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** Must hold lock. Persists before updating memory. */
    private Task transition(Task task, TaskStatus status, JsonNode result, String error) {
        Task updated = task.toBuilder()
                .status(status)
                .result(result)
                .error(error)
                .updatedAt(Instant.now())
                .build();
        store.save(updated);
        tasks.put(updated.taskId(), updated);
        return updated;
    }
}
