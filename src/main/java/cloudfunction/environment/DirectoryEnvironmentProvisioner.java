package cloudfunction.environment;

import cloudfunction.common.FileTrees;
import cloudfunction.common.Names;
import cloudfunction.common.ProvisioningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Keeps one directory per project under the environments root.
 *
 * <p>Installing dependencies merges the system manifest with the project's
 * {@code dependencies.txt}, copies every jar into {@code <env>/lib}, removes jars that
 * are no longer listed and writes {@code dependencies.lock}.
 */
public class DirectoryEnvironmentProvisioner implements EnvironmentProvisioner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryEnvironmentProvisioner.class);

    private final Path projectsDir;
    private final Path envsDir;
    private final Path systemManifest;

    public DirectoryEnvironmentProvisioner(Path projectsDir, Path envsDir, Path systemManifest) {
        this.projectsDir = projectsDir;
        this.envsDir = envsDir;
        this.systemManifest = systemManifest;
    }

    @Override
    public EnvironmentHandle ensureEnvironment(String project) {
        Names.requireValid("project", project);
        Path projectDir = projectsDir.resolve(project);
        if (!Files.isDirectory(projectDir)) {
            throw new ProvisioningException(project, "Project directory not found: " + projectDir);
        }
        Path root = envsDir.resolve(project);
        EnvironmentHandle handle = new EnvironmentHandle(project, root);
        try {
            if (!Files.isDirectory(handle.libDir())) {
                Files.createDirectories(handle.libDir());
                log.info("Created environment for project {} at {}", project, root);
            }
        } catch (IOException e) {
            throw new ProvisioningException(project, "Failed to create environment " + root + ": " + e.getMessage(), e);
        }
        return handle;
    }

    @Override
    public void installDependencies(String project, EnvironmentHandle handle) {
        DependencyManifest merged;
        try {
            DependencyManifest system = DependencyManifest.read(systemManifest);
            DependencyManifest own = DependencyManifest.read(projectsDir.resolve(project).resolve(DependencyManifest.FILE_NAME));
            merged = system.overlay(own);
        } catch (IOException e) {
            throw new ProvisioningException(project, "Failed to read dependency manifest: " + e.getMessage(), e);
        }

        Path lib = handle.libDir();
        Set<String> installed = new HashSet<>();
        try {
            Files.createDirectories(lib);
            for (Map.Entry<String, Path> entry : merged.entries().entrySet()) {
                Path jar = entry.getValue();
                if (!Files.isRegularFile(jar)) {
                    throw new ProvisioningException(project, "Dependency " + entry.getKey() + " not found: " + jar);
                }
                String fileName = jar.getFileName().toString();
                Files.copy(jar, lib.resolve(fileName), StandardCopyOption.REPLACE_EXISTING);
                installed.add(fileName);
            }
            removeStale(lib, installed);
            Files.write(handle.lockFile(), merged.lockLines(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProvisioningException(project, "Failed to install dependencies: " + e.getMessage(), e);
        }
        log.info("Installed {} dependencies for project {}", installed.size(), project);
    }

    @Override
    public void removeEnvironment(String project) {
        Names.requireValid("project", project);
        Path root = envsDir.resolve(project);
        if (!Files.exists(root)) {
            return;
        }
        try {
            FileTrees.deleteTree(root);
            log.info("Removed environment for project {}", project);
        } catch (IOException e) {
            throw new ProvisioningException(project, "Failed to remove environment " + root + ": " + e.getMessage(), e);
        }
    }

    private static void removeStale(Path lib, Set<String> keep) throws IOException {
        try (Stream<Path> files = Files.list(lib)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (!keep.contains(p.getFileName().toString())) {
                    Files.deleteIfExists(p);
                }
            }
        }
    }
}
