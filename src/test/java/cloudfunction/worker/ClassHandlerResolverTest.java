package cloudfunction.worker;

import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.Jsons;
import cloudfunction.testfunctions.TestProjects;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import static org.junit.jupiter.api.Assertions.*;

class ClassHandlerResolverTest {

    @TempDir
    Path dir;

    private final ClassHandlerResolver resolver = new ClassHandlerResolver();
    private final ClassLoader loader = getClass().getClassLoader();

    private FunctionHandler handler(String entry, Map<String, String> env) throws Exception {
        Path file = TestProjects.writeDescriptor(dir, entry, TestProjects.DEMO_CLASS, entry);
        return resolver.resolve(resolver.describe(file), loader, env);
    }

    @Test
    @DisplayName("lists descriptors sorted and skips underscore-prefixed ones")
    void listsFunctionFiles() throws Exception {
        TestProjects.createProject(dir, "p", "echo", "boom");
        Path project = dir.resolve("p");
        TestProjects.writeDescriptor(project, "_private", TestProjects.DEMO_CLASS, "echo");
        Files.writeString(project.resolve("README.md"), "docs");

        List<Path> files = resolver.listFunctionFiles(project);

        assertEquals(2, files.size());
        assertEquals("boom", FunctionDescriptor.functionName(files.get(0)));
        assertEquals("echo", FunctionDescriptor.functionName(files.get(1)));
        assertTrue(resolver.listFunctionFiles(dir.resolve("missing")).isEmpty());
    }

    @Test
    void echoReturnsPayloadUnchanged() throws Exception {
        JsonNode payload = Jsons.mapper().readTree("{\"msg\":\"hi\"}");
        FunctionHandler h = handler("echo", Map.of());

        assertFalse(h.isAsync());
        assertEquals(payload, h.invoke(payload));
    }

    @Test
    @DisplayName("payload is converted to the entry point's parameter type")
    void convertsPayloadToPojo() throws Exception {
        Object result = handler("greet", Map.of()).invoke(Jsons.mapper().readTree("{\"name\":\"Ada\"}"));
        assertEquals(Map.of("greeting", "Hello, Ada"), result);
    }

    @Test
    void environmentIsPassedToTwoArgumentEntryPoints() throws Exception {
        Object result = handler("env", Map.of("REGION", "eu"))
                .invoke(Jsons.mapper().readTree("{\"key\":\"REGION\"}"));
        assertEquals("eu", result);
    }

    @Test
    void completionStageMakesHandlerAsync() throws Exception {
        FunctionHandler h = handler("asyncEcho", Map.of());
        assertTrue(h.isAsync());
        Object stage = h.invoke(Jsons.mapper().readTree("1"));
        assertTrue(stage instanceof CompletionStage);
    }

    @Test
    @DisplayName("exceptions thrown by the function are unwrapped")
    void unwrapsFunctionExceptions() throws Exception {
        FunctionHandler h = handler("boom", Map.of());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> h.invoke(null));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void unknownClassOrEntryFailsToLoad() throws Exception {
        Path missingClass = TestProjects.writeDescriptor(dir, "a", "com.example.Missing", "main");
        Path missingEntry = TestProjects.writeDescriptor(dir, "b", TestProjects.DEMO_CLASS, "nope");

        assertThrows(FunctionLoadException.class,
                () -> resolver.resolve(resolver.describe(missingClass), loader, Map.of()));
        assertThrows(FunctionLoadException.class,
                () -> resolver.resolve(resolver.describe(missingEntry), loader, Map.of()));
    }

    @Test
    void descriptorWithoutClassIsRejected() throws Exception {
        Path file = dir.resolve("bad.function.json");
        Files.writeString(file, "{\"entry\":\"main\"}");
        assertThrows(FunctionLoadException.class, () -> resolver.describe(file));

        Path garbage = dir.resolve("garbage.function.json");
        Files.writeString(garbage, "{{{");
        assertThrows(FunctionLoadException.class, () -> resolver.describe(garbage));
    }

    @Test
    void entryDefaultsToMain() throws Exception {
        Path file = dir.resolve("x.function.json");
        Files.writeString(file, "{\"class\":\"com.example.X\"}");
        FunctionDescriptor d = resolver.describe(file);
        assertEquals("x", d.name());
        assertEquals(FunctionDescriptor.DEFAULT_ENTRY, d.entry());
    }
}
