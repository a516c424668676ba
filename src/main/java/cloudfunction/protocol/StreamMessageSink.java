package cloudfunction.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes messages as JSON lines to a stream (a child's stdin, or the worker's stdout).
 */
public final class StreamMessageSink implements MessageSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamMessageSink.class);

    private final BufferedWriter writer;
    private boolean closed;

    public StreamMessageSink(OutputStream out) {
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    @Override
    public synchronized void send(WorkerMessage message) throws IOException {
        if (closed) {
            throw new IOException("sink closed");
        }
        writer.write(MessageCodec.encode(message));
        writer.newLine();
        writer.flush();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Closing message stream failed: {}", e.getMessage());
        }
    }
}
