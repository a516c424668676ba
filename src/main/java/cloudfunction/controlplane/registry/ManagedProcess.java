package cloudfunction.controlplane.registry;

import java.time.Duration;

/**
 * Handle on whatever runs a worker: an OS process or a thread of this JVM.
 */
public interface ManagedProcess {

    long pid();

    boolean isAlive();

    /** Polite termination */
    void destroy();

    void destroyForcibly();

    /**
     * @return true if the process ended within the timeout
     */
    boolean waitFor(Duration timeout) throws InterruptedException;
}
