package cloudfunction.controlplane.core;

/**
 * Service state of the {@link Master}.
 */
public enum MasterState {
    NEW,
    INITIALIZING,
    RUNNING,
    STOPPING,
    STOPPED
}
