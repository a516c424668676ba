package cloudfunction.controlplane.registry;

import cloudfunction.protocol.MessageSink;
import cloudfunction.protocol.MessageType;
import cloudfunction.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Command channel of one project.
 *
 * <p>Outbound commands go through the attached {@link MessageSink}. Inbound messages
 * are delivered by the transport: {@code ready} fires the readiness signal, replies
 * land in a bounded queue with a single consumer (the master).
 */
public final class MessageChannel {

    private static final Logger log = LoggerFactory.getLogger(MessageChannel.class);

    private final String name;
    private final BlockingQueue<WorkerMessage> replies;
    private final ReadySignal readySignal;
    private volatile MessageSink sink;
    private volatile boolean closed;

    public MessageChannel(String name, int capacity, ReadySignal readySignal) {
        this.name = name;
        this.replies = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.readySignal = readySignal;
    }

    public String name() {
        return name;
    }

    public ReadySignal readySignal() {
        return readySignal;
    }

    public void attach(MessageSink sink) {
        this.sink = sink;
    }

    public void send(WorkerMessage message) throws IOException {
        MessageSink current = sink;
        if (closed || current == null) {
            throw new IOException("Channel " + name + " is not connected");
        }
        current.send(message);
    }

    /**
     * Called by the transport for every message coming from the worker.
     */
    public void deliver(WorkerMessage message) {
        if (message.type() == MessageType.READY) {
            readySignal.signal();
            return;
        }
        if (closed) {
            log.debug("Channel {} closed, dropping {}", name, message.type());
            return;
        }
        if (!replies.offer(message)) {
            log.warn("Channel {} full, dropping reply {}", name, message.requestId());
        }
    }

    /**
     * Blocks up to {@code timeout} for the next reply.
     */
    public Optional<WorkerMessage> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(replies.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public List<WorkerMessage> drain() {
        List<WorkerMessage> drained = new ArrayList<>();
        replies.drainTo(drained);
        return drained;
    }

    public boolean isClosed() {
        return closed;
    }

    public void close() {
        closed = true;
        sink = null;
        replies.clear();
    }
}
