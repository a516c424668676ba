package cloudfunction.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for deploying a project from a directory on the control plane host.
 */
public record DeployProjectRequest(@JsonProperty("source") String source) {

    public void validate() {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
    }
}
