package cloudfunction.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One message on a worker channel.
 *
 * <pre>
 * {"type":"stop"}
 * {"type":"execute","requestId":"..","function_name":"echo","payload":{..}}
 * {"type":"ready"}
 * {"type":"result","requestId":"..","status":"success","result":..}
 * {"type":"result","requestId":"..","status":"error","error":".."}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMessage(
        @JsonProperty("type") MessageType type,
        @JsonProperty("requestId") String requestId,
        @JsonProperty("function_name") String functionName,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("status") String status,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error) {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    public WorkerMessage {
        Objects.requireNonNull(type, "type is required");
    }

    public static WorkerMessage stop() {
        return new WorkerMessage(MessageType.STOP, null, null, null, null, null, null);
    }

    public static WorkerMessage ready() {
        return new WorkerMessage(MessageType.READY, null, null, null, null, null, null);
    }

    public static WorkerMessage execute(String requestId, String functionName, JsonNode payload) {
        return new WorkerMessage(MessageType.EXECUTE, requestId, functionName, payload, null, null, null);
    }

    public static WorkerMessage success(String requestId, JsonNode result) {
        return new WorkerMessage(MessageType.RESULT, requestId, null, null, STATUS_SUCCESS, result, null);
    }

    public static WorkerMessage error(String requestId, String error) {
        return new WorkerMessage(MessageType.RESULT, requestId, null, null, STATUS_ERROR, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return type == MessageType.RESULT && STATUS_SUCCESS.equals(status);
    }

    @JsonIgnore
    public boolean isStop() {
        return type == MessageType.STOP;
    }
}
