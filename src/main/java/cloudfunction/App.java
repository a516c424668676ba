package cloudfunction;

import cloudfunction.controlplane.config.ControlPlaneConfig;
import cloudfunction.controlplane.config.Dependencies;
import cloudfunction.controlplane.core.StartupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Control plane entry point. Configuration comes from {@code CLOUDFN_*} environment variables.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        ControlPlaneConfig config = ControlPlaneConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            shutdown.countDown();
        }, "cloudfunction-shutdown"));

        StartupReport report;
        try {
            report = deps.start();
        } catch (RuntimeException e) {
            log.error("Control plane failed to start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        log.info("Control plane running: {} projects started, {} failed",
                report.started().size(), report.failed().size());

        shutdown.await();
    }
}
