package cloudfunction.controlplane.project;

import cloudfunction.common.CloudFunctionException;
import cloudfunction.common.FileTrees;
import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.Names;
import cloudfunction.common.ProjectNotFoundException;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.core.Master;
import cloudfunction.environment.EnvironmentProvisioner;
import cloudfunction.worker.FunctionDescriptor;
import cloudfunction.worker.HandlerResolver;
import cloudfunction.worker.ProjectClassLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Deploys and deletes projects and functions. Every change that affects a running
 * project restarts its worker; a failed deploy restores the previous files.
 */
public class ProjectManager {

    private static final Logger log = LoggerFactory.getLogger(ProjectManager.class);

    private final ControlPlaneConfig config;
    private final FunctionCatalog catalog;
    private final HandlerResolver resolver;
    private final EnvironmentProvisioner provisioner;
    private final Master master;

    public ProjectManager(ControlPlaneConfig config,
            FunctionCatalog catalog,
            HandlerResolver resolver,
            EnvironmentProvisioner provisioner,
            Master master) {
        this.config = config;
        this.catalog = catalog;
        this.resolver = resolver;
        this.provisioner = provisioner;
        this.master = master;
    }

    /**
     * Installs (or replaces) a project from a source directory and restarts its worker.
     *
     * @return whether the restarted worker became ready
     */
    public boolean deployProject(String project, Path sourceDir) {
        Names.requireValid("project", project);
        if (sourceDir == null || !Files.isDirectory(sourceDir)) {
            throw new IllegalArgumentException("source directory not found: " + sourceDir);
        }
        for (Path file : listFunctionFiles(sourceDir)) {
            resolver.describe(file);
        }

        Path target = catalog.projectDir(project);
        Path backup = config.projectsDir().resolve("." + project + ".backup");
        try {
            Files.createDirectories(config.projectsDir());
            FileTrees.deleteTree(backup);
            if (Files.exists(target)) {
                Files.move(target, backup, StandardCopyOption.ATOMIC_MOVE);
            }
            try {
                FileTrees.copyTree(sourceDir, target);
            } catch (IOException e) {
                restore(backup, target);
                throw e;
            }
            FileTrees.deleteTree(backup);
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to deploy project " + project + ": " + e.getMessage(), e);
        }
        log.info("Deployed project {} from {}", project, sourceDir);
        return master.restartProject(project);
    }

    /**
     * Writes a function descriptor after checking that its entry point resolves, then
     * restarts the project's worker.
     *
     * @throws FunctionLoadException if the entry point cannot be resolved (nothing is changed)
     */
    public boolean deployFunction(String project, String function, String className, String entry, String description) {
        Names.requireValid("function", function);
        if (!catalog.projectExists(project)) {
            throw new ProjectNotFoundException(project);
        }
        Path projectDir = catalog.projectDir(project);
        Path file = projectDir.resolve(function + FunctionDescriptor.SUFFIX);
        FunctionDescriptor descriptor = new FunctionDescriptor(function, file, className, entry, description);
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("class is required");
        }
        validate(project, projectDir, descriptor);

        Path backup = projectDir.resolve(file.getFileName() + ".bak");
        try {
            if (Files.exists(file)) {
                Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            }
            try {
                descriptor.write();
            } catch (IOException e) {
                if (Files.exists(backup)) {
                    Files.move(backup, file, StandardCopyOption.REPLACE_EXISTING);
                }
                throw e;
            }
            Files.deleteIfExists(backup);
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to deploy function " + function + ": " + e.getMessage(), e);
        }
        log.info("Deployed function {} of project {} ({}.{})", function, project, className, descriptor.entry());
        return master.restartProject(project);
    }

    /**
     * @return false if the function did not exist
     */
    public boolean deleteFunction(String project, String function) {
        Names.requireValid("function", function);
        if (!catalog.projectExists(project)) {
            throw new ProjectNotFoundException(project);
        }
        Path file = catalog.projectDir(project).resolve(function + FunctionDescriptor.SUFFIX);
        try {
            if (!Files.deleteIfExists(file)) {
                return false;
            }
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to delete function " + function + ": " + e.getMessage(), e);
        }
        log.info("Deleted function {} of project {}", function, project);
        master.restartProject(project);
        return true;
    }

    /**
     * Stops the project's worker, then removes its directory and environment.
     *
     * @return false if the project did not exist
     */
    public boolean deleteProject(String project) {
        Names.requireValid("project", project);
        if (!catalog.projectExists(project)) {
            return false;
        }
        master.stopProject(project);
        Path dir = catalog.projectDir(project);
        try {
            FileTrees.deleteTree(dir);
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to delete project " + project + ": " + e.getMessage(), e);
        }
        provisioner.removeEnvironment(project);
        log.info("Deleted project {}", project);
        return true;
    }

    private void validate(String project, Path projectDir, FunctionDescriptor descriptor) {
        Path envLib = config.envsDir().resolve(project).resolve("lib");
        try (URLClassLoader loader = ProjectClassLoader.create(project, projectDir, envLib,
                ProjectManager.class.getClassLoader())) {
            resolver.resolve(descriptor, loader, Map.of());
        } catch (IOException e) {
            log.debug("Failed to close validation class loader: {}", e.getMessage());
        }
    }

    private Iterable<Path> listFunctionFiles(Path dir) {
        try {
            return resolver.listFunctionFiles(dir);
        } catch (IOException e) {
            throw new CloudFunctionException("Cannot read " + dir + ": " + e.getMessage(), e);
        }
    }

    private static void restore(Path backup, Path target) throws IOException {
        FileTrees.deleteTree(target);
        if (Files.exists(backup)) {
            Files.move(backup, target, StandardCopyOption.ATOMIC_MOVE);
        }
    }
}
