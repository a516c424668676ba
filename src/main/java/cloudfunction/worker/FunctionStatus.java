package cloudfunction.worker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Load state of a function inside its worker.
 */
public enum FunctionStatus {
    /** Descriptor found but could not be read or its entry point could not be resolved */
    UNREGISTERED,
    /** Descriptor read, handler not resolved yet */
    REGISTERED,
    /** Handler resolved and callable */
    LOADED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
