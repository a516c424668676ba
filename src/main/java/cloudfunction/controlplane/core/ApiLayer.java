package cloudfunction.controlplane.core;

/**
 * External request surface started and stopped by the {@link Master}.
 */
public interface ApiLayer {

    void start() throws Exception;

    boolean isReady();

    void stop();
}
