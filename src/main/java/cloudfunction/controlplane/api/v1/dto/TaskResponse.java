package cloudfunction.controlplane.api.v1.dto;

import cloudfunction.controlplane.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Response DTO for a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("project_name") String projectName,
        @JsonProperty("function_name") String functionName,
        @JsonProperty("status") String status,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.taskId(),
                task.projectName(),
                task.functionName(),
                task.status().wireName(),
                task.payload(),
                task.result(),
                task.error(),
                task.createdAt(),
                task.updatedAt());
    }
}
