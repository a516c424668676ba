package cloudfunction.controlplane.registry;

import java.time.Duration;

/**
 * A worker running on a thread of the control plane JVM. Destroying it interrupts the thread.
 */
final class ThreadProcess implements ManagedProcess {

    private final Thread thread;

    ThreadProcess(Thread thread) {
        this.thread = thread;
    }

    @Override
    public long pid() {
        return thread.getId();
    }

    @Override
    public boolean isAlive() {
        return thread.isAlive();
    }

    @Override
    public void destroy() {
        thread.interrupt();
    }

    @Override
    public void destroyForcibly() {
        thread.interrupt();
    }

    @Override
    public boolean waitFor(Duration timeout) throws InterruptedException {
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    @Override
    public String toString() {
        return "ThreadProcess{" + thread.getName() + "}";
    }
}
