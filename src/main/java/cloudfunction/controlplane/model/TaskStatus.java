package cloudfunction.controlplane.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task execution status.
 */
public enum TaskStatus {
    /** Task created, waiting for an execution slot */
    CREATED,
    /** Function invocation in progress */
    RUNNING,
    /** Function returned a result */
    COMPLETED,
    /** Function raised, or no worker was available */
    FAILED,
    /** Task cancelled by user */
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static TaskStatus fromString(String value) {
        for (TaskStatus s : values()) {
            if (s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown task status: " + value);
    }

    public boolean isActive() {
        return this == CREATED || this == RUNNING;
    }
}
