package cloudfunction.environment;

import cloudfunction.common.ProvisioningException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryEnvironmentProvisionerTest {

    @TempDir
    Path base;

    private Path projectsDir;
    private Path envsDir;
    private Path systemManifest;
    private DirectoryEnvironmentProvisioner provisioner;

    @BeforeEach
    void setUp() throws Exception {
        projectsDir = Files.createDirectories(base.resolve("projects"));
        envsDir = base.resolve("envs");
        systemManifest = base.resolve(DependencyManifest.FILE_NAME);
        Files.createDirectories(base.resolve("jars"));
        Files.writeString(base.resolve("jars/gson-2.10.jar"), "old gson");
        Files.writeString(base.resolve("jars/gson-2.11.jar"), "new gson");
        Files.writeString(base.resolve("jars/commons-lang3-3.14.0.jar"), "lang");
        provisioner = new DirectoryEnvironmentProvisioner(projectsDir, envsDir, systemManifest);
    }

    @Test
    void artifactKeyStripsVersionAndExtension() {
        assertEquals("gson", DependencyManifest.artifactKey("gson-2.10.1.jar"));
        assertEquals("commons-lang3", DependencyManifest.artifactKey("commons-lang3-3.14.0.jar"));
        assertEquals("plain", DependencyManifest.artifactKey("Plain.jar"));
    }

    @Test
    @DisplayName("project manifest wins over system manifest for the same artifact")
    void projectDependenciesOverrideSystem() throws Exception {
        Files.writeString(systemManifest, "jars/gson-2.10.jar\njars/commons-lang3-3.14.0.jar # shared\n");
        Path demo = Files.createDirectories(projectsDir.resolve("demo"));
        Files.writeString(demo.resolve(DependencyManifest.FILE_NAME), "../../jars/gson-2.11.jar\n");

        EnvironmentHandle handle = provisioner.ensureEnvironment("demo");
        provisioner.installDependencies("demo", handle);

        assertTrue(Files.exists(handle.libDir().resolve("gson-2.11.jar")));
        assertFalse(Files.exists(handle.libDir().resolve("gson-2.10.jar")));
        assertTrue(Files.exists(handle.libDir().resolve("commons-lang3-3.14.0.jar")));
        List<String> lock = Files.readAllLines(handle.lockFile());
        assertEquals(2, lock.size());
        assertTrue(lock.get(0).startsWith("commons-lang3="));
        assertTrue(lock.get(1).startsWith("gson=") && lock.get(1).endsWith("gson-2.11.jar"));
    }

    @Test
    void staleJarsAreRemovedOnReinstall() throws Exception {
        Path demo = Files.createDirectories(projectsDir.resolve("demo"));
        Files.writeString(demo.resolve(DependencyManifest.FILE_NAME), "../../jars/gson-2.10.jar\n");
        EnvironmentHandle handle = provisioner.ensureEnvironment("demo");
        provisioner.installDependencies("demo", handle);

        Files.writeString(demo.resolve(DependencyManifest.FILE_NAME), "../../jars/commons-lang3-3.14.0.jar\n");
        provisioner.installDependencies("demo", handle);

        assertFalse(Files.exists(handle.libDir().resolve("gson-2.10.jar")));
        assertTrue(Files.exists(handle.libDir().resolve("commons-lang3-3.14.0.jar")));
    }

    @Test
    void missingJarFailsProvisioning() throws Exception {
        Path demo = Files.createDirectories(projectsDir.resolve("demo"));
        Files.writeString(demo.resolve(DependencyManifest.FILE_NAME), "missing-1.0.jar\n");
        EnvironmentHandle handle = provisioner.ensureEnvironment("demo");

        ProvisioningException e = assertThrows(ProvisioningException.class,
                () -> provisioner.installDependencies("demo", handle));
        assertTrue(e.getMessage().contains("missing"), e.getMessage());
    }

    @Test
    void unknownProjectCannotBeProvisioned() {
        assertThrows(ProvisioningException.class, () -> provisioner.ensureEnvironment("ghost"));
    }

    @Test
    void removeEnvironmentDeletesDirectoryAndIsIdempotent() throws Exception {
        Files.createDirectories(projectsDir.resolve("demo"));
        EnvironmentHandle handle = provisioner.ensureEnvironment("demo");
        assertTrue(Files.isDirectory(handle.libDir()));

        provisioner.removeEnvironment("demo");
        provisioner.removeEnvironment("demo");

        assertFalse(Files.exists(envsDir.resolve("demo")));
    }
}
