package cloudfunction.controlplane.core;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link Master#start()}: projects whose worker became ready and the reason
 * each of the others did not.
 */
public record StartupReport(List<String> started, Map<String, String> failed) {

    public StartupReport {
        started = List.copyOf(started);
        failed = Map.copyOf(failed);
    }

    public boolean allStarted() {
        return failed.isEmpty();
    }
}
