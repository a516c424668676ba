package cloudfunction.protocol;

import cloudfunction.common.Jsons;

import java.io.IOException;

/**
 * JSON-lines codec for {@link WorkerMessage}. One message per line.
 * A bare {@code stop} or {@code "stop"} line is accepted as the stop sentinel.
 */
public final class MessageCodec {

    private MessageCodec() {
    }

    public static String encode(WorkerMessage message) {
        return Jsons.toJson(message);
    }

    public static WorkerMessage decode(String line) throws IOException {
        if (line == null) {
            throw new IOException("null message line");
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            throw new IOException("empty message line");
        }
        if ("stop".equals(trimmed) || "\"stop\"".equals(trimmed)) {
            return WorkerMessage.stop();
        }
        try {
            return Jsons.mapper().readValue(trimmed, WorkerMessage.class);
        } catch (IOException | RuntimeException e) {
            throw new IOException("malformed worker message: " + abbreviate(trimmed), e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
