package cloudfunction.controlplane.api.v1;

import cloudfunction.common.Jsons;
import cloudfunction.controlplane.api.Controller;
import cloudfunction.controlplane.api.v1.dto.DeployFunctionRequest;
import cloudfunction.controlplane.api.v1.dto.DeployProjectRequest;
import cloudfunction.controlplane.project.FunctionCatalog;
import cloudfunction.controlplane.project.ProjectManager;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Project and function management.
 *
 * GET    /api/v1/projects                                - List projects
 * POST   /api/v1/projects/{project}                      - Deploy project from a local directory
 * DELETE /api/v1/projects/{project}                      - Delete project
 * GET    /api/v1/projects/{project}/functions            - List functions
 * POST   /api/v1/projects/{project}/functions/{function} - Deploy function descriptor
 * DELETE /api/v1/projects/{project}/functions/{function} - Delete function
 */
public class ProjectController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private static final Pattern PROJECTS_PATTERN = Pattern.compile("^/api/v1/projects$");
    private static final Pattern PROJECT_PATTERN = Pattern.compile("^/api/v1/projects/([^/]+)$");
    private static final Pattern FUNCTIONS_PATTERN = Pattern.compile("^/api/v1/projects/([^/]+)/functions$");
    private static final Pattern FUNCTION_PATTERN = Pattern.compile("^/api/v1/projects/([^/]+)/functions/([^/]+)$");

    private final FunctionCatalog catalog;
    private final ProjectManager projectManager;

    public ProjectController(FunctionCatalog catalog, ProjectManager projectManager) {
        this.catalog = catalog;
        this.projectManager = projectManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return PROJECTS_PATTERN.matcher(path).matches() || FUNCTIONS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE)) {
            return PROJECT_PATTERN.matcher(path).matches() || FUNCTION_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();
        if (method.equals(HttpMethod.GET) && PROJECTS_PATTERN.matcher(path).matches()) {
            return ControllerResponse.json(Map.of("projects", catalog.listProjects()));
        }

        Matcher functions = FUNCTIONS_PATTERN.matcher(path);
        if (method.equals(HttpMethod.GET) && functions.matches()) {
            String project = functions.group(1);
            return ControllerResponse.json(Map.of("project", project, "functions", catalog.listFunctions(project)));
        }

        Matcher function = FUNCTION_PATTERN.matcher(path);
        if (function.matches()) {
            String project = function.group(1);
            String name = function.group(2);
            if (method.equals(HttpMethod.POST)) {
                return handleDeployFunction(req, project, name);
            }
            if (!projectManager.deleteFunction(project, name)) {
                return ControllerResponse.notFound("function not found: " + name);
            }
            return ControllerResponse.json(Map.of("deleted", name));
        }

        Matcher project = PROJECT_PATTERN.matcher(path);
        if (project.matches()) {
            String name = project.group(1);
            if (method.equals(HttpMethod.POST)) {
                return handleDeployProject(req, name);
            }
            if (!projectManager.deleteProject(name)) {
                return ControllerResponse.notFound("project not found: " + name);
            }
            return ControllerResponse.json(Map.of("deleted", name));
        }

        return ControllerResponse.notFound("unknown project endpoint");
    }

    private ControllerResponse handleDeployProject(FullHttpRequest req, String project) throws Exception {
        DeployProjectRequest request = Jsons.mapper().readValue(
                req.content().toString(StandardCharsets.UTF_8), DeployProjectRequest.class);
        request.validate();
        boolean ready = projectManager.deployProject(project, Paths.get(request.source()));
        log.info("Project {} deployed via API, worker ready: {}", project, ready);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("project", project);
        response.put("ready", ready);
        return ControllerResponse.json(HttpResponseStatus.CREATED, response);
    }

    private ControllerResponse handleDeployFunction(FullHttpRequest req, String project, String function)
            throws Exception {
        DeployFunctionRequest request = Jsons.mapper().readValue(
                req.content().toString(StandardCharsets.UTF_8), DeployFunctionRequest.class);
        request.validate();
        boolean ready = projectManager.deployFunction(project, function,
                request.className(), request.entry(), request.description());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("project", project);
        response.put("function", function);
        response.put("ready", ready);
        return ControllerResponse.json(HttpResponseStatus.CREATED, response);
    }
}
