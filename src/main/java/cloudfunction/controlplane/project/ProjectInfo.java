package cloudfunction.controlplane.project;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog entry for a project.
 */
public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("function_count") int functionCount) {
}
