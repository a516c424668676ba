package cloudfunction.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the health endpoint.
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("master") String master,
        @JsonProperty("workers") List<String> workers,
        @JsonProperty("active_tasks") int activeTasks) {
}
