package cloudfunction.controlplane.project;

import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.Jsons;
import cloudfunction.common.ProjectNotFoundException;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.config.Dependencies;
import cloudfunction.controlplane.registry.WorkerHandle;
import cloudfunction.testfunctions.TestProjects;
import cloudfunction.worker.FunctionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectManagerTest {

    @TempDir
    Path base;

    private ControlPlaneConfig config;
    private Dependencies deps;
    private ProjectManager manager;
    private FunctionCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        config = TestProjects.inProcessConfig(base);
        TestProjects.createProject(config.projectsDir(), "demo", "echo");
        deps = Dependencies.create(config);
        deps.master().start();
        manager = deps.projectManager();
        catalog = deps.catalog();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    @DisplayName("catalog lists projects with function counts and descriptor details")
    void catalogListing() throws Exception {
        Path demo = config.projectsDir().resolve("demo");
        Files.writeString(demo.resolve("bad.function.json"), "{\"entry\":\"x\"}");
        Files.createDirectories(config.projectsDir().resolve(".hidden"));

        List<ProjectInfo> projects = catalog.listProjects();
        assertEquals(1, projects.size());
        assertEquals("demo", projects.get(0).name());
        assertEquals(2, projects.get(0).functionCount());

        List<FunctionInfo> functions = catalog.listFunctions("demo");
        FunctionInfo bad = functions.get(0);
        assertEquals("bad", bad.name());
        assertEquals(FunctionStatus.UNREGISTERED, bad.status());
        assertNotNull(bad.error());
        FunctionInfo echo = functions.get(1);
        assertEquals(FunctionStatus.REGISTERED, echo.status());
        assertEquals(TestProjects.DEMO_CLASS, echo.className());
        assertEquals("echo", echo.entry());

        assertThrows(ProjectNotFoundException.class, () -> catalog.listFunctions("ghost"));
    }

    @Test
    @DisplayName("deploying a function restarts the worker and makes it callable")
    void deployFunction() throws Exception {
        WorkerHandle before = deps.registry().workerHandle("demo").orElseThrow();

        assertTrue(manager.deployFunction("demo", "hello", TestProjects.DEMO_CLASS, "greet", "says hello"));

        assertNotSame(before, deps.registry().workerHandle("demo").orElseThrow());
        JsonNode result = deps.master().executeFunction("demo", "hello", Jsons.mapper().readTree("{\"name\":\"Bo\"}"));
        assertEquals("Hello, Bo", result.get("greeting").asText());
        assertTrue(catalog.listFunctions("demo").stream()
                .anyMatch(f -> f.name().equals("hello") && "says hello".equals(f.description())));
    }

    @Test
    @DisplayName("a function whose entry point does not resolve is rejected without touching disk")
    void deployFunctionValidatesEntryPoint() {
        assertThrows(FunctionLoadException.class,
                () -> manager.deployFunction("demo", "nope", TestProjects.DEMO_CLASS, "missingMethod", null));
        assertFalse(Files.exists(config.projectsDir().resolve("demo/nope.function.json")));
        assertThrows(ProjectNotFoundException.class,
                () -> manager.deployFunction("ghost", "f", TestProjects.DEMO_CLASS, "echo", null));
        assertThrows(IllegalArgumentException.class,
                () -> manager.deployFunction("demo", "f", "", "echo", null));
    }

    @Test
    void deleteFunction() {
        assertTrue(manager.deleteFunction("demo", "echo"));
        assertFalse(manager.deleteFunction("demo", "echo"));
        assertTrue(catalog.listFunctions("demo").isEmpty());
    }

    @Test
    @DisplayName("deploying a project copies its files and starts a worker")
    void deployProject() throws Exception {
        Path source = TestProjects.createProject(base.resolve("incoming"), "src", "echo", "boom");

        assertTrue(manager.deployProject("fresh", source));

        assertTrue(catalog.projectExists("fresh"));
        assertTrue(deps.registry().checkProcessStatus("fresh"));
        assertEquals(7, deps.master().executeFunction("fresh", "echo", Jsons.mapper().readTree("7")).asInt());
    }

    @Test
    @DisplayName("redeploying replaces the previous files")
    void redeployReplacesFiles() throws Exception {
        Path source = TestProjects.createProject(base.resolve("incoming"), "v2", "boom");

        manager.deployProject("demo", source);

        List<FunctionInfo> functions = catalog.listFunctions("demo");
        assertEquals(1, functions.size());
        assertEquals("boom", functions.get(0).name());
        assertFalse(Files.exists(config.projectsDir().resolve(".demo.backup")));
    }

    @Test
    void deployProjectRejectsBadSource() throws Exception {
        Path source = Files.createDirectories(base.resolve("incoming/bad"));
        Files.writeString(source.resolve("x.function.json"), "{}");

        assertThrows(FunctionLoadException.class, () -> manager.deployProject("demo", source));
        assertThrows(IllegalArgumentException.class, () -> manager.deployProject("demo", base.resolve("missing")));
        assertEquals(1, catalog.listFunctions("demo").size());
    }

    @Test
    @DisplayName("deleting a project stops its worker and removes files and environment")
    void deleteProject() {
        WorkerHandle handle = deps.registry().workerHandle("demo").orElseThrow();

        assertTrue(manager.deleteProject("demo"));

        assertFalse(handle.process().isAlive());
        assertFalse(catalog.projectExists("demo"));
        assertFalse(Files.exists(config.envsDir().resolve("demo")));
        assertTrue(deps.registry().workerHandle("demo").isEmpty());
        assertFalse(manager.deleteProject("demo"));
    }
}
