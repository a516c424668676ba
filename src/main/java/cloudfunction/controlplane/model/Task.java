package cloudfunction.controlplane.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one asynchronous invocation.
 * Updates go through {@link #toBuilder()}.
 */
public final class Task {
    private final String taskId;
    private final String projectName;
    private final String functionName;
    private final JsonNode payload;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final JsonNode result;
    private final String error;

    private Task(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.projectName = Objects.requireNonNull(builder.projectName, "projectName is required");
        this.functionName = Objects.requireNonNull(builder.functionName, "functionName is required");
        this.payload = builder.payload;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.result = builder.result;
        this.error = builder.error;
    }

    /**
     * Task ids have the form {@code <project>_<function>_<uuid>}.
     */
    public static String newTaskId(String projectName, String functionName) {
        return projectName + "_" + functionName + "_" + UUID.randomUUID();
    }

    // Getters
    public String taskId() {
        return taskId;
    }

    public String projectName() {
        return projectName;
    }

    public String functionName() {
        return functionName;
    }

    public JsonNode payload() {
        return payload;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public JsonNode result() {
        return result;
    }

    public String error() {
        return error;
    }

    /** Created or running */
    public boolean isActive() {
        return status.isActive();
    }

    public boolean isTerminal() {
        return !status.isActive();
    }

    public boolean isFor(String project, String function) {
        return projectName.equals(project) && functionName.equals(function);
    }

    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .projectName(projectName)
                .functionName(functionName)
                .payload(payload)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .result(result)
                .error(error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String projectName;
        private String functionName;
        private JsonNode payload;
        private TaskStatus status = TaskStatus.CREATED;
        private Instant createdAt;
        private Instant updatedAt;
        private JsonNode result;
        private String error;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(taskId, task.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public String toString() {
        return "Task{id='" + taskId + "', status=" + status + "}";
    }
}
