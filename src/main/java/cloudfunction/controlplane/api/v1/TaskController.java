package cloudfunction.controlplane.api.v1;

import cloudfunction.controlplane.api.Controller;
import cloudfunction.controlplane.api.v1.dto.TaskResponse;
import cloudfunction.controlplane.model.Task;
import cloudfunction.controlplane.model.TaskStatus;
import cloudfunction.controlplane.service.TaskManager;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asynchronous invocation.
 *
 * POST /api/v1/tasks/{project}/{function} - Create task (body is the payload)
 * GET  /api/v1/tasks                      - List tasks (?project=&status=)
 * GET  /api/v1/tasks/{taskId}             - Task status (?wait=seconds blocks until terminal)
 * POST /api/v1/tasks/{taskId}/cancel      - Cancel task
 */
public class TaskController implements Controller {

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern CREATE_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/([^/]+)$");
    private static final Pattern TASK_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");

    private static final long MAX_WAIT_SECONDS = 60;

    private final TaskManager taskManager;

    public TaskController(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST)) {
            return CANCEL_PATTERN.matcher(path).matches() || CREATE_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());

        if (req.method().equals(HttpMethod.GET)) {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(query);
            }
            Matcher task = TASK_PATTERN.matcher(path);
            if (task.matches()) {
                return handleGet(task.group(1), query);
            }
        }

        Matcher cancel = CANCEL_PATTERN.matcher(path);
        if (cancel.matches()) {
            boolean cancelled = taskManager.cancelTask(cancel.group(1));
            return ControllerResponse.json(Map.of("task_id", cancel.group(1), "cancelled", cancelled));
        }

        Matcher create = CREATE_PATTERN.matcher(path);
        if (create.matches()) {
            Task task = taskManager.createTask(create.group(1), create.group(2), FunctionController.readPayload(req));
            return ControllerResponse.json(HttpResponseStatus.ACCEPTED, TaskResponse.from(task));
        }

        return ControllerResponse.notFound("unknown task endpoint");
    }

    private ControllerResponse handleList(QueryStringDecoder query) {
        String project = param(query, "project");
        String status = param(query, "status");
        List<TaskResponse> tasks = taskManager.listTasks(project, status == null ? null : TaskStatus.fromString(status))
                .stream()
                .map(TaskResponse::from)
                .toList();
        return ControllerResponse.json(Map.of("tasks", tasks));
    }

    private ControllerResponse handleGet(String taskId, QueryStringDecoder query) throws InterruptedException {
        String wait = param(query, "wait");
        Optional<Task> task;
        if (wait != null) {
            long seconds = Math.min(MAX_WAIT_SECONDS, Math.max(0, Long.parseLong(wait)));
            task = taskManager.awaitTask(taskId, Duration.ofSeconds(seconds));
        } else {
            task = taskManager.getTaskStatus(taskId);
        }
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found: " + taskId);
        }
        return ControllerResponse.json(TaskResponse.from(task.get()));
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
