package cloudfunction.controlplane.scheduler;

import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.model.ScheduledJob;
import cloudfunction.controlplane.model.Task;
import cloudfunction.controlplane.service.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled work:
 * - cron jobs: each firing creates a task through the {@link TaskManager}
 * - TaskSweeper: removes expired task records at a fixed interval
 *
 * Uses a single-threaded executor; task creation returns immediately, so jobs do not delay each other.
 */
public class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskManager taskManager;
    private final TaskSweeper sweeper;
    private final ControlPlaneConfig config;
    private final Clock clock;
    private final Map<String, ZonedDateTime> nextFireTimes = new ConcurrentHashMap<>();
    private final List<ScheduledJob> jobs = new ArrayList<>();

    private volatile boolean running = false;

    public TaskScheduler(TaskManager taskManager, ControlPlaneConfig config) {
        this(taskManager, config, Clock.system(config.scheduleZone()));
    }

    public TaskScheduler(TaskManager taskManager, ControlPlaneConfig config, Clock clock) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cloudfunction-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskManager = taskManager;
        this.sweeper = new TaskSweeper(taskManager, config.taskRetentionDays());
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start the sweeper and every given job.
     */
    public synchronized void start(List<ScheduledJob> scheduledJobs) {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        long sweepMs = config.taskSweepInterval().toMillis();
        executor.scheduleAtFixedRate(sweeper, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        log.info("Task sweeper scheduled every {}ms", sweepMs);

        for (ScheduledJob job : scheduledJobs) {
            jobs.add(job);
            scheduleNext(job);
        }
        log.info("Scheduler started with {} jobs", jobs.size());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public TaskSweeper sweeper() {
        return sweeper;
    }

    public synchronized List<ScheduledJob> jobs() {
        return List.copyOf(jobs);
    }

    public Optional<ZonedDateTime> nextFireTime(String jobId) {
        return Optional.ofNullable(nextFireTimes.get(jobId));
    }

    private void scheduleNext(ScheduledJob job) {
        if (!running) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        Optional<ZonedDateTime> next = job.trigger().nextFireAfter(now);
        if (next.isEmpty()) {
            log.warn("Scheduled job {} has no future fire time, dropping it", job.id());
            nextFireTimes.remove(job.id());
            return;
        }
        nextFireTimes.put(job.id(), next.get());
        long delayMs = Math.max(0, Duration.between(now, next.get()).toMillis());
        executor.schedule(() -> fire(job), delayMs, TimeUnit.MILLISECONDS);
        log.debug("Scheduled job {} next fires at {}", job.id(), next.get());
    }

    private void fire(ScheduledJob job) {
        try {
            Task task = taskManager.createTask(job.project(), job.function(), job.args().deepCopy());
            log.info("Scheduled job {} fired, task {}", job.id(), task.taskId());
        } catch (Exception e) {
            log.error("Scheduled job {} failed to create task", job.id(), e);
        } finally {
            scheduleNext(job);
        }
    }
}
