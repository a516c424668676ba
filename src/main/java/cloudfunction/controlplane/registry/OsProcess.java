package cloudfunction.controlplane.registry;

import cloudfunction.protocol.StreamMessageSink;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A worker running as a child JVM.
 */
final class OsProcess implements ManagedProcess {

    private final Process process;
    private final StreamMessageSink stdin;

    OsProcess(Process process, StreamMessageSink stdin) {
        this.process = process;
        this.stdin = stdin;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void destroy() {
        stdin.close();
        process.destroy();
    }

    @Override
    public void destroyForcibly() {
        stdin.close();
        process.destroyForcibly();
    }

    @Override
    public boolean waitFor(Duration timeout) throws InterruptedException {
        boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (exited) {
            stdin.close();
        }
        return exited;
    }

    @Override
    public String toString() {
        return "OsProcess{pid=" + process.pid() + "}";
    }
}
