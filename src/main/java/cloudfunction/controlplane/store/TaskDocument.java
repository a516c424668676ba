package cloudfunction.controlplane.store;

import cloudfunction.controlplane.model.Task;
import cloudfunction.controlplane.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * On-disk (and over-the-wire) shape of a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskDocument(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("project_name") String projectName,
        @JsonProperty("function_name") String functionName,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error) {

    public static TaskDocument from(Task task) {
        return new TaskDocument(task.taskId(), task.projectName(), task.functionName(), task.payload(),
                task.status(), task.createdAt(), task.updatedAt(), task.result(), task.error());
    }

    public Task toTask() {
        return Task.builder()
                .taskId(taskId)
                .projectName(projectName)
                .functionName(functionName)
                .payload(payload)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .result(result)
                .error(error)
                .build();
    }
}
