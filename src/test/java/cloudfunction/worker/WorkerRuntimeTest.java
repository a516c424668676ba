package cloudfunction.worker;

import cloudfunction.common.Jsons;
import cloudfunction.environment.DirectoryEnvironmentProvisioner;
import cloudfunction.protocol.MessageSink;
import cloudfunction.protocol.MessageType;
import cloudfunction.protocol.WorkerMessage;
import cloudfunction.testfunctions.TestProjects;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRuntimeTest {

    @TempDir
    Path base;

    private Path projectsDir;
    private LinkedBlockingQueue<WorkerMessage> inbound;
    private List<WorkerMessage> outbound;
    private CountingPool pool;

    /** Thread pool that counts submitted jobs. */
    private static final class CountingPool extends ThreadPoolExecutor {
        final AtomicInteger submitted = new AtomicInteger();

        CountingPool() {
            super(2, 2, 0, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
        }

        @Override
        public void execute(Runnable command) {
            submitted.incrementAndGet();
            super.execute(command);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        projectsDir = Files.createDirectories(base.resolve("projects"));
        inbound = new LinkedBlockingQueue<>();
        outbound = new CopyOnWriteArrayList<>();
        pool = new CountingPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private WorkerRuntime runtime(String project) {
        MessageSink sink = outbound::add;
        return new WorkerRuntime(project, projectsDir.resolve(project), base.resolve(".env"),
                new DirectoryEnvironmentProvisioner(projectsDir, base.resolve("envs"), base.resolve("dependencies.txt")),
                new ClassHandlerResolver(), inbound, sink, pool, Duration.ofMillis(50));
    }

    private WorkerMessage lastReply() {
        return outbound.get(outbound.size() - 1);
    }

    @Test
    @DisplayName("initialization loads functions and signals ready")
    void initializeSignalsReady() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "echo", "boom");
        WorkerRuntime runtime = runtime("demo");

        runtime.initialize();

        assertTrue(runtime.isInitialized());
        assertEquals(MessageType.READY, outbound.get(0).type());
        assertEquals(2, runtime.functions().list().size());
        assertTrue(runtime.functions().list().stream().allMatch(f -> f.status() == FunctionStatus.LOADED));
    }

    @Test
    void executesSynchronousFunctionOnPool() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "echo");
        WorkerRuntime runtime = runtime("demo");
        runtime.initialize();
        JsonNode payload = Jsons.mapper().readTree("{\"msg\":\"hi\"}");

        assertFalse(runtime.execute(WorkerMessage.execute("r1", "echo", payload)));

        WorkerMessage reply = lastReply();
        assertTrue(reply.isSuccess());
        assertEquals("r1", reply.requestId());
        assertEquals(payload, reply.result());
        assertEquals(1, pool.submitted.get());
        assertEquals("success", runtime.invocations().entries().get(0).outcome());
    }

    @Test
    @DisplayName("function exception is reported as type and message")
    void reportsFunctionError() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "boom");
        WorkerRuntime runtime = runtime("demo");
        runtime.initialize();

        runtime.execute(WorkerMessage.execute("r1", "boom", null));

        WorkerMessage reply = lastReply();
        assertFalse(reply.isSuccess());
        assertEquals("IllegalArgumentException: boom", reply.error());
    }

    @Test
    @DisplayName("unknown function is rejected without dispatching to the pool")
    void unknownFunctionNotDispatched() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "echo");
        WorkerRuntime runtime = runtime("demo");
        runtime.initialize();

        runtime.execute(WorkerMessage.execute("r1", "missing", null));

        assertEquals("Function missing not found in project demo", lastReply().error());
        assertEquals(0, pool.submitted.get());
    }

    @Test
    void asyncFunctionIsAwaited() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "asyncEcho");
        WorkerRuntime runtime = runtime("demo");
        runtime.initialize();

        runtime.execute(WorkerMessage.execute("r1", "asyncEcho", Jsons.mapper().readTree("7")));

        WorkerMessage reply = lastReply();
        assertTrue(reply.isSuccess(), String.valueOf(reply.error()));
        assertEquals(7, reply.result().get("async").asInt());
        assertEquals(0, pool.submitted.get());
    }

    @Test
    @DisplayName("failed initialization still signals ready, then every call errors")
    void failedInitializationStillReady() {
        WorkerRuntime runtime = runtime("ghost");

        runtime.initialize();

        assertFalse(runtime.isInitialized());
        assertEquals(MessageType.READY, outbound.get(0).type());
        runtime.execute(WorkerMessage.execute("r1", "echo", null));
        assertTrue(lastReply().error().startsWith("Worker for project ghost is not initialized"),
                lastReply().error());
    }

    @Test
    @DisplayName("a function that fails to load stays registered and reports the load error")
    void brokenFunctionReportsLoadError() throws Exception {
        Path dir = TestProjects.createProject(projectsDir, "demo", "echo");
        TestProjects.writeDescriptor(dir, "broken", "com.example.Missing", "main");
        WorkerRuntime runtime = runtime("demo");
        runtime.initialize();

        assertEquals(FunctionStatus.REGISTERED, runtime.functions().get("broken").orElseThrow().status());
        runtime.execute(WorkerMessage.execute("r1", "broken", null));

        assertTrue(lastReply().error().startsWith("Function broken failed to load"), lastReply().error());
    }

    @Test
    @DisplayName("stop during a long call ends the call and the serve loop")
    void stopWhileRunning() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "slow");
        WorkerRuntime runtime = runtime("demo");
        runtime.initialize();
        inbound.put(WorkerMessage.stop());

        boolean stopped = runtime.execute(
                WorkerMessage.execute("r1", "slow", Jsons.mapper().readTree("{\"ms\":10000}")));

        assertTrue(stopped);
        assertEquals("Worker for project demo stopped while running slow", lastReply().error());
        assertTrue(inbound.isEmpty());
    }

    @Test
    void runLoopServesUntilStop() throws Exception {
        TestProjects.createProject(projectsDir, "demo", "echo");
        WorkerRuntime runtime = runtime("demo");
        inbound.put(WorkerMessage.execute("r1", "echo", Jsons.mapper().readTree("1")));
        inbound.put(WorkerMessage.stop());

        Thread t = new Thread(runtime, "worker-test");
        t.start();
        t.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(t.isAlive());
        assertEquals(2, outbound.size());
        assertEquals(MessageType.READY, outbound.get(0).type());
        assertTrue(outbound.get(1).isSuccess());
    }
}
