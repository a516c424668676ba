package cloudfunction.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for deploying a function: the descriptor contents.
 */
public record DeployFunctionRequest(
        @JsonProperty("class") String className,
        @JsonProperty("entry") String entry,
        @JsonProperty("description") String description) {

    public void validate() {
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("class is required");
        }
    }
}
