package cloudfunction.controlplane.registry;

import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.environment.EnvironmentProvisioner;
import cloudfunction.protocol.WorkerMessage;
import cloudfunction.worker.HandlerResolver;
import cloudfunction.worker.WorkerRuntime;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Function;

/**
 * Runs each worker loop on a dedicated thread of this JVM. Same message protocol,
 * carried over in-memory queues instead of pipes.
 */
public class InProcessWorkerLauncher implements WorkerLauncher {

    private final ControlPlaneConfig config;
    private final EnvironmentProvisioner provisioner;
    private final HandlerResolver resolver;
    private final Function<String, ExecutorService> executors;

    public InProcessWorkerLauncher(ControlPlaneConfig config,
            EnvironmentProvisioner provisioner,
            HandlerResolver resolver,
            Function<String, ExecutorService> executors) {
        this.config = config;
        this.provisioner = provisioner;
        this.resolver = resolver;
        this.executors = executors;
    }

    @Override
    public ManagedProcess launch(String project, MessageChannel channel) throws IOException {
        BlockingQueue<WorkerMessage> toWorker = new LinkedBlockingQueue<>(config.channelCapacity());
        channel.attach(message -> {
            if (!toWorker.offer(message)) {
                throw new IOException("Command queue of worker " + project + " is full");
            }
        });
        WorkerRuntime runtime = new WorkerRuntime(project,
                config.projectsDir().resolve(project),
                config.systemEnvFile(),
                provisioner,
                resolver,
                toWorker,
                channel::deliver,
                executors.apply(project),
                config.responsePollInterval());
        Thread thread = new Thread(runtime, "worker-" + project);
        thread.setDaemon(true);
        thread.start();
        return new ThreadProcess(thread);
    }
}
