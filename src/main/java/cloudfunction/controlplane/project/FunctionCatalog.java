package cloudfunction.controlplane.project;

import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.Names;
import cloudfunction.common.ProjectNotFoundException;
import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.worker.FunctionDescriptor;
import cloudfunction.worker.FunctionStatus;
import cloudfunction.worker.HandlerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only view of the projects root: which projects exist and which functions they declare.
 * Load status comes from the descriptors on disk; workers own the live function state.
 */
public class FunctionCatalog {

    private static final Logger log = LoggerFactory.getLogger(FunctionCatalog.class);

    private final Path projectsDir;
    private final HandlerResolver resolver;

    public FunctionCatalog(ControlPlaneConfig config, HandlerResolver resolver) {
        this.projectsDir = config.projectsDir();
        this.resolver = resolver;
    }

    public Path projectsDir() {
        return projectsDir;
    }

    public List<String> listProjectNames() {
        if (!Files.isDirectory(projectsDir)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(projectsDir)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(Names::isValid)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list projects in " + projectsDir, e);
        }
    }

    public boolean projectExists(String project) {
        return Names.isValid(project) && Files.isDirectory(projectsDir.resolve(project));
    }

    public Path projectDir(String project) {
        return projectsDir.resolve(Names.requireValid("project", project));
    }

    public List<ProjectInfo> listProjects() {
        List<ProjectInfo> projects = new ArrayList<>();
        for (String name : listProjectNames()) {
            Path dir = projectsDir.resolve(name);
            projects.add(new ProjectInfo(name, dir.toAbsolutePath().toString(), functionFiles(name, dir).size()));
        }
        return projects;
    }

    /**
     * @throws ProjectNotFoundException if the project does not exist
     */
    public List<FunctionInfo> listFunctions(String project) {
        if (!projectExists(project)) {
            throw new ProjectNotFoundException(project);
        }
        List<FunctionInfo> functions = new ArrayList<>();
        for (Path file : functionFiles(project, projectsDir.resolve(project))) {
            String name = FunctionDescriptor.functionName(file);
            try {
                FunctionDescriptor d = resolver.describe(file);
                functions.add(new FunctionInfo(name, FunctionStatus.REGISTERED, d.description(),
                        d.className(), d.entry(), null));
            } catch (FunctionLoadException e) {
                functions.add(new FunctionInfo(name, FunctionStatus.UNREGISTERED, null, null, null, e.getMessage()));
            }
        }
        return functions;
    }

    private List<Path> functionFiles(String project, Path dir) {
        try {
            return resolver.listFunctionFiles(dir);
        } catch (IOException e) {
            log.warn("Cannot list functions of project {}: {}", project, e.getMessage());
            return List.of();
        }
    }
}
