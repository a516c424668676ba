package cloudfunction.controlplane.integration;

import cloudfunction.common.FunctionExecutionException;
import cloudfunction.common.Jsons;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.config.Dependencies;
import cloudfunction.controlplane.config.WorkerLaunchMode;
import cloudfunction.controlplane.core.Master;
import cloudfunction.controlplane.registry.WorkerHandle;
import cloudfunction.testfunctions.TestProjects;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests with every project worker in its own child JVM.
 */
class ProcessWorkerIntegrationTest {

        @TempDir
        Path base;

        private Dependencies deps;
        private Master master;

        @BeforeEach
        void setUp() throws Exception {
                ControlPlaneConfig config = TestProjects.inProcessConfig(base)
                                .withWorkerLaunchMode(WorkerLaunchMode.PROCESS)
                                .withWorkerReadyTimeout(Duration.ofSeconds(60))
                                .withTerminateTimeout(Duration.ofSeconds(5));
                Path demo = TestProjects.createProject(config.projectsDir(), "demo", "echo", "boom", "env");
                Files.writeString(demo.resolve(".env"), "GREETING=hello from .env\n");

                deps = Dependencies.create(config);
                assertTrue(deps.start().allStarted());
                master = deps.master();
        }

        @AfterEach
        void tearDown() {
                deps.close();
        }

        @Test
        @DisplayName("echo and error round trips through a child JVM")
        void roundTrips() throws Exception {
                JsonNode payload = Jsons.mapper().readTree("{\"msg\":\"hi\"}");
                assertEquals(payload, master.executeFunction("demo", "echo", payload));

                FunctionExecutionException e = assertThrows(FunctionExecutionException.class,
                                () -> master.executeFunction("demo", "boom", null));
                assertEquals("IllegalArgumentException: boom", e.getMessage());
        }

        @Test
        void projectEnvironmentReachesTheFunction() throws Exception {
                JsonNode result = master.executeFunction("demo", "env", Jsons.mapper().readTree("{\"key\":\"GREETING\"}"));
                assertEquals("hello from .env", result.asText());
        }

        @Test
        @DisplayName("a killed worker process is replaced on the next call")
        void killedWorkerIsRestarted() throws Exception {
                WorkerHandle first = deps.registry().workerHandle("demo").orElseThrow();
                long firstPid = first.process().pid();

                first.process().destroyForcibly();
                assertTrue(first.process().waitFor(Duration.ofSeconds(10)));

                JsonNode result = master.executeFunction("demo", "echo", Jsons.mapper().readTree("{\"ok\":1}"));

                assertEquals(1, result.get("ok").asInt());
                WorkerHandle second = deps.registry().workerHandle("demo").orElseThrow();
                assertNotEquals(firstPid, second.process().pid());
                assertTrue(second.isLive());
        }

        @Test
        void stopTerminatesChildProcesses() {
                WorkerHandle handle = deps.registry().workerHandle("demo").orElseThrow();

                deps.close();

                assertFalse(handle.process().isAlive());
                assertTrue(Files.exists(base.resolve("logs/projects/demo.log")));
        }
}
