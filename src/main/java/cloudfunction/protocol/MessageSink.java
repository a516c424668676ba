package cloudfunction.protocol;

import java.io.IOException;

/**
 * Outbound side of a worker channel.
 */
@FunctionalInterface
public interface MessageSink {

    void send(WorkerMessage message) throws IOException;
}
