package cloudfunction.controlplane.project;

import cloudfunction.worker.FunctionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog entry for a function, read from its descriptor on disk.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionInfo(
        @JsonProperty("name") String name,
        @JsonProperty("status") FunctionStatus status,
        @JsonProperty("description") String description,
        @JsonProperty("class") String className,
        @JsonProperty("entry") String entry,
        @JsonProperty("error") String error) {
}
