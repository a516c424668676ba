package cloudfunction.controlplane.registry;

import java.time.Instant;

/**
 * A started worker. Live means the process is alive and has signalled readiness.
 */
public record WorkerHandle(String project, ManagedProcess process, MessageChannel channel, Instant startedAt) {

    public ReadySignal readySignal() {
        return channel.readySignal();
    }

    public boolean isReady() {
        return channel.readySignal().isSignalled();
    }

    public boolean isLive() {
        return process.isAlive() && isReady();
    }
}
