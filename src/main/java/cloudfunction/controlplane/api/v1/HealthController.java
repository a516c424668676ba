package cloudfunction.controlplane.api.v1;

import cloudfunction.controlplane.api.Controller;
import cloudfunction.controlplane.api.v1.dto.HealthResponse;
import cloudfunction.controlplane.core.Master;
import cloudfunction.controlplane.core.MasterState;
import cloudfunction.controlplane.registry.CoordinationRegistry;
import cloudfunction.controlplane.service.TaskManager;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Health check controller.
 * GET /health, GET /api/v1/health
 */
public class HealthController implements Controller {

    private final Master master;
    private final TaskManager taskManager;
    private final CoordinationRegistry registry;

    public HealthController(Master master, TaskManager taskManager, CoordinationRegistry registry) {
        this.master = master;
        this.taskManager = taskManager;
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && ("/health".equals(path) || "/api/v1/health".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<String> live = new ArrayList<>();
        for (String project : registry.managedProjects()) {
            if (registry.checkProcessStatus(project)) {
                live.add(project);
            }
        }
        MasterState state = master.state();
        boolean healthy = state == MasterState.RUNNING || state == MasterState.INITIALIZING;
        HealthResponse response = new HealthResponse(healthy ? "ok" : "unavailable",
                state.name().toLowerCase(), live, taskManager.activeTaskCount());
        return ControllerResponse.json(healthy ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE,
                response);
    }
}
