package cloudfunction.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Reads JSON lines from a stream and hands each decoded message to a consumer.
 * Malformed lines are logged and skipped. {@code onClose} runs once at end of stream.
 */
public final class MessagePump implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MessagePump.class);

    private final String name;
    private final InputStream in;
    private final Consumer<WorkerMessage> consumer;
    private final Runnable onClose;

    public MessagePump(String name, InputStream in, Consumer<WorkerMessage> consumer, Runnable onClose) {
        this.name = name;
        this.in = in;
        this.consumer = consumer;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage message;
                try {
                    message = MessageCodec.decode(line);
                } catch (IOException e) {
                    log.warn("[{}] {}", name, e.getMessage());
                    continue;
                }
                consumer.accept(message);
            }
        } catch (IOException e) {
            log.debug("[{}] stream closed: {}", name, e.getMessage());
        } finally {
            if (onClose != null) {
                onClose.run();
            }
        }
    }
}
