package cloudfunction.controlplane.registry;

import cloudfunction.protocol.WorkerMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launcher whose workers are plain latches: they signal ready at once (unless told not to),
 * record the commands they receive and exit on {@code stop}.
 */
public class FakeWorkerLauncher implements WorkerLauncher {

    public final AtomicInteger launches = new AtomicInteger();
    public final List<WorkerMessage> sent = new CopyOnWriteArrayList<>();
    public final Set<String> failing;
    public volatile boolean signalReady = true;
    public volatile boolean closed;

    public FakeWorkerLauncher(String... failingProjects) {
        this.failing = Set.of(failingProjects);
    }

    @Override
    public ManagedProcess launch(String project, MessageChannel channel) throws IOException {
        launches.incrementAndGet();
        if (failing.contains(project)) {
            throw new IOException("cannot launch " + project);
        }
        FakeProcess process = new FakeProcess();
        channel.attach(message -> {
            sent.add(message);
            if (message.isStop()) {
                process.exit();
            }
        });
        if (signalReady) {
            channel.deliver(WorkerMessage.ready());
        }
        return process;
    }

    @Override
    public void close() {
        closed = true;
    }

    public static final class FakeProcess implements ManagedProcess {

        private final CountDownLatch exited = new CountDownLatch(1);
        public volatile boolean ignoreStop;

        void exit() {
            if (!ignoreStop) {
                exited.countDown();
            }
        }

        @Override
        public long pid() {
            return 42;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        @Override
        public void destroy() {
            exited.countDown();
        }

        @Override
        public void destroyForcibly() {
            exited.countDown();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
