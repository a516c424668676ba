package cloudfunction.controlplane.registry;

import cloudfunction.common.ConfigurationException;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.protocol.WorkerMessage;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationRegistryTest {

    @TempDir
    Path base;

    private FakeWorkerLauncher launcher;
    private CoordinationRegistry registry;

    @BeforeEach
    void setUp() {
        ControlPlaneConfig config = ControlPlaneConfig.defaults()
                .withBaseDir(base)
                .withTerminateTimeout(Duration.ofMillis(300))
                .withResponsePollInterval(Duration.ofMillis(20));
        launcher = new FakeWorkerLauncher("broken");
        registry = new CoordinationRegistry(config, reg -> launcher);
    }

    @AfterEach
    void tearDown() {
        registry.cleanupResources();
    }

    @Test
    @DisplayName("component slots: unknown names rejected, empty slots absent")
    void componentSlots() {
        assertThrows(ConfigurationException.class, () -> registry.get("nonexistent"));
        assertThrows(ConfigurationException.class, () -> registry.register("nonexistent", new Object()));
        assertTrue(registry.get("master").isEmpty());
        assertSame(registry, registry.get("registry").orElseThrow());

        Object master = new Object();
        registry.register("master", master);
        assertSame(master, registry.get(ComponentName.MASTER).orElseThrow());
        assertTrue(registry.get(ComponentName.MASTER, String.class).isEmpty());
    }

    @Test
    void startThenStatusThenTerminate() {
        assertTrue(registry.startProjectProcess("demo"));
        assertTrue(registry.waitForReady("demo", Duration.ofSeconds(1)));
        assertTrue(registry.checkProcessStatus("demo"));
        assertEquals(List.of("demo"), new ArrayList<>(registry.managedProjects()));

        assertTrue(registry.terminateProcess("demo"));

        assertFalse(registry.checkProcessStatus("demo"));
        assertTrue(registry.workerHandle("demo").isEmpty());
        assertTrue(launcher.sent.get(launcher.sent.size() - 1).isStop());
    }

    @Test
    @DisplayName("starting an already running project is a no-op")
    void startIsIdempotent() {
        assertTrue(registry.startProjectProcess("demo"));
        assertTrue(registry.startProjectProcess("demo"));
        assertEquals(1, launcher.launches.get());
    }

    @Test
    @DisplayName("concurrent starts of one project launch a single worker")
    void concurrentStartsLaunchOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return registry.startProjectProcess("demo");
            }));
        }
        go.countDown();
        for (Future<Boolean> f : results) {
            assertTrue(f.get(5, TimeUnit.SECONDS));
        }
        pool.shutdownNow();

        assertEquals(1, launcher.launches.get());
        assertEquals(1, registry.managedProjects().size());
    }

    @Test
    void deadWorkerIsReplacedOnStart() {
        registry.startProjectProcess("demo");
        WorkerHandle first = registry.workerHandle("demo").orElseThrow();
        first.process().destroyForcibly();
        assertFalse(registry.checkProcessStatus("demo"));

        assertTrue(registry.startProjectProcess("demo"));

        assertEquals(2, launcher.launches.get());
        assertNotSame(first, registry.workerHandle("demo").orElseThrow());
        assertTrue(first.channel().isClosed());
    }

    @Test
    @DisplayName("launch failure returns false and leaves nothing behind")
    void launchFailureCleansUp() {
        assertFalse(registry.startProjectProcess("broken"));
        assertTrue(registry.workerHandle("broken").isEmpty());
        assertFalse(registry.checkProcessStatus("broken"));
    }

    @Test
    void terminateUnknownProjectIsNoOp() {
        assertTrue(registry.terminateProcess("never-started"));
        assertEquals(0, launcher.launches.get());
    }

    @Test
    @DisplayName("worker ignoring stop is force-killed after the terminate timeout")
    void forceKillsStubbornWorker() {
        registry.startProjectProcess("demo");
        FakeWorkerLauncher.FakeProcess process =
                (FakeWorkerLauncher.FakeProcess) registry.workerHandle("demo").orElseThrow().process();
        process.ignoreStop = true;

        assertTrue(registry.terminateProcess("demo"));

        assertFalse(process.isAlive());
    }

    @Test
    void waitForReadyTimesOutWithoutSignal() {
        launcher.signalReady = false;
        registry.startProjectProcess("demo");

        assertFalse(registry.waitForReady("demo", Duration.ofMillis(100)));
        assertFalse(registry.checkProcessStatus("demo"));
        assertFalse(registry.waitForReady("unknown", Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("replies are queued, ready messages fire the signal")
    void channelDelivery() throws Exception {
        MessageChannel channel = registry.channel("demo");
        channel.deliver(WorkerMessage.ready());
        channel.deliver(WorkerMessage.error("r1", "x"));

        assertTrue(registry.readySignal("demo").isSignalled());
        assertEquals("r1", channel.receive(Duration.ofMillis(10)).orElseThrow().requestId());
        assertTrue(channel.receive(Duration.ofMillis(10)).isEmpty());
    }

    @Test
    void cleanupTaskResourcesFiresSignal() throws Exception {
        ReadySignal signal = registry.taskSignal("t1");
        assertSame(signal, registry.taskSignal("t1"));

        registry.cleanupTaskResources("t1");

        assertTrue(signal.await(Duration.ZERO));
        assertTrue(registry.existingTaskSignal("t1").isEmpty());
    }

    @Test
    @DisplayName("full cleanup stops workers, closes components and the launcher")
    void cleanupResourcesReleasesEverything() {
        registry.startProjectProcess("a");
        registry.startProjectProcess("b");
        CountDownLatch closed = new CountDownLatch(1);
        registry.register(ComponentName.TASK_MANAGER, (AutoCloseable) closed::countDown);
        ReadySignal task = registry.taskSignal("t1");

        registry.cleanupResources();

        assertTrue(registry.managedProjects().isEmpty());
        assertEquals(0, closed.getCount());
        assertTrue(registry.get(ComponentName.TASK_MANAGER).isEmpty());
        assertTrue(task.isSignalled());
        assertTrue(launcher.closed);
    }
}
