package cloudfunction.controlplane.registry;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-shot latch. Set once, never reset; a restarted worker gets a fresh signal.
 */
public final class ReadySignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void signal() {
        latch.countDown();
    }

    public boolean isSignalled() {
        return latch.getCount() == 0;
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
