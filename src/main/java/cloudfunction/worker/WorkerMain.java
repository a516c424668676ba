package cloudfunction.worker;

import cloudfunction.common.NamedThreadFactory;
import cloudfunction.environment.DirectoryEnvironmentProvisioner;
import cloudfunction.protocol.MessagePump;
import cloudfunction.protocol.StreamMessageSink;
import cloudfunction.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Entry point of a worker child process. Commands arrive as JSON lines on stdin,
 * replies leave as JSON lines on stdout. Everything else a function prints goes to stderr.
 */
@Command(name = "cloudfunction-worker", mixinStandardHelpOptions = true,
        description = "Runs the functions of one project")
public final class WorkerMain implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    @Option(names = "--project", required = true, description = "Project name")
    String project;

    @Option(names = "--projects-dir", required = true, description = "Projects root directory")
    Path projectsDir;

    @Option(names = "--envs-dir", required = true, description = "Environments root directory")
    Path envsDir;

    @Option(names = "--system-env", description = "System .env file")
    Path systemEnv;

    @Option(names = "--system-deps", description = "System dependency manifest")
    Path systemDeps;

    @Option(names = "--pool-size", defaultValue = "10", description = "Threads for synchronous functions")
    int poolSize;

    @Option(names = "--poll-millis", defaultValue = "1000", description = "Stop check interval while a function runs")
    long pollMillis;

    public static void main(String[] args) {
        int code = new CommandLine(new WorkerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        // stdout belongs to the protocol
        StreamMessageSink out = new StreamMessageSink(new FileOutputStream(FileDescriptor.out));
        System.setOut(System.err);

        BlockingQueue<WorkerMessage> inbound = new LinkedBlockingQueue<>();
        Thread reader = new Thread(new MessagePump("worker-" + project + "-stdin",
                new FileInputStream(FileDescriptor.in),
                inbound::add,
                () -> inbound.add(WorkerMessage.stop())), "worker-stdin");
        reader.setDaemon(true);
        reader.start();

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, poolSize),
                new NamedThreadFactory("fn-" + project + "-"));
        try {
            WorkerRuntime runtime = new WorkerRuntime(project,
                    projectsDir.resolve(project),
                    systemEnv,
                    new DirectoryEnvironmentProvisioner(projectsDir, envsDir, systemDeps),
                    new ClassHandlerResolver(),
                    inbound,
                    out,
                    pool,
                    Duration.ofMillis(pollMillis));
            log.info("Worker for project {} starting (pid {})", project, ProcessHandle.current().pid());
            runtime.run();
        } finally {
            pool.shutdownNow();
            out.close();
        }
        return 0;
    }
}
