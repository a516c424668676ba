package cloudfunction.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kinds of message exchanged between the control plane and a worker.
 */
public enum MessageType {
    /** Control plane to worker: leave the command loop and exit */
    @JsonProperty("stop")
    STOP,
    /** Control plane to worker: run a function */
    @JsonProperty("execute")
    EXECUTE,
    /** Worker to control plane: initialization finished (sent exactly once) */
    @JsonProperty("ready")
    READY,
    /** Worker to control plane: outcome of an execute command */
    @JsonProperty("result")
    RESULT
}
