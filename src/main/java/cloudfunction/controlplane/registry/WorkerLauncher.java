package cloudfunction.controlplane.registry;

import java.io.IOException;

/**
 * Spawns the worker for a project and wires it to the project's channel.
 */
public interface WorkerLauncher extends AutoCloseable {

    ManagedProcess launch(String project, MessageChannel channel) throws IOException;

    @Override
    default void close() {
    }
}
