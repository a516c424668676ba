package cloudfunction.controlplane.config;

/**
 * How project workers are hosted.
 */
public enum WorkerLaunchMode {
    /** One child JVM per project (default) */
    PROCESS,
    /** Worker loop on a dedicated thread of the control plane JVM */
    IN_PROCESS
}
