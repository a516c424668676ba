package cloudfunction.controlplane.scheduler;

import cloudfunction.common.Jsons;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.model.ScheduledJob;
import cloudfunction.controlplane.model.Task;
import cloudfunction.controlplane.model.TaskStatus;
import cloudfunction.controlplane.registry.ComponentName;
import cloudfunction.controlplane.registry.CoordinationRegistry;
import cloudfunction.controlplane.registry.FakeWorkerLauncher;
import cloudfunction.controlplane.core.FunctionInvoker;
import cloudfunction.controlplane.service.TaskManager;
import cloudfunction.controlplane.store.FileTaskStore;
import cloudfunction.testfunctions.TestProjects;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    @TempDir
    Path base;

    private ControlPlaneConfig config;
    private CoordinationRegistry registry;
    private FileTaskStore store;
    private TaskManager taskManager;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = TestProjects.inProcessConfig(base).withTaskSweepInterval(Duration.ofMillis(200));
        registry = new CoordinationRegistry(config, reg -> new FakeWorkerLauncher());
        FunctionInvoker echo = (project, function, payload) -> payload;
        registry.register(ComponentName.MASTER, echo);
        store = new FileTaskStore(config.tasksDir());
        taskManager = new TaskManager(store, registry, config);
        scheduler = new TaskScheduler(taskManager, config);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        taskManager.close();
        registry.cleanupResources();
    }

    @Test
    @DisplayName("a job firing every second creates tasks with the job's args")
    void cronJobCreatesTasks() throws Exception {
        ScheduledJob job = new ScheduledJob("tick", "demo", "echo",
                Jsons.mapper().readTree("{\"n\":1}"), CronTrigger.of(Map.of("second", "*")));

        scheduler.start(List.of(job));
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.nextFireTime("tick").isPresent());

        long deadline = System.currentTimeMillis() + 10_000;
        List<Task> tasks = taskManager.listTasks("demo", TaskStatus.COMPLETED);
        while (tasks.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            tasks = taskManager.listTasks("demo", TaskStatus.COMPLETED);
        }

        assertFalse(tasks.isEmpty(), "no task created by the scheduled job");
        assertEquals(1, tasks.get(0).result().get("n").asInt());
        assertEquals("echo", tasks.get(0).functionName());
    }

    @Test
    @DisplayName("the sweeper deletes expired records on its interval")
    void sweeperRunsPeriodically() throws Exception {
        Instant old = Instant.now().minus(Duration.ofDays(30));
        store.save(Task.builder().taskId("demo_echo_old").projectName("demo").functionName("echo")
                .status(TaskStatus.COMPLETED).createdAt(old).updatedAt(old).build());

        scheduler.start(List.of());

        long deadline = System.currentTimeMillis() + 10_000;
        while (store.findById("demo_echo_old").isPresent() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertTrue(store.findById("demo_echo_old").isEmpty());
    }

    @Test
    void sweepReturnsDeletedCount() {
        Instant old = Instant.now().minus(Duration.ofDays(8));
        Instant recent = Instant.now().minus(Duration.ofDays(1));
        store.save(Task.builder().taskId("demo_echo_a").projectName("demo").functionName("echo")
                .status(TaskStatus.FAILED).createdAt(old).updatedAt(old).build());
        store.save(Task.builder().taskId("demo_echo_b").projectName("demo").functionName("echo")
                .status(TaskStatus.COMPLETED).createdAt(recent).updatedAt(recent).build());

        assertEquals(1, new TaskSweeper(taskManager, 7).sweep());
        assertEquals(0, new TaskSweeper(taskManager, 7).sweep());
    }

    @Test
    void stopIsIdempotent() {
        scheduler.start(List.of());
        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
