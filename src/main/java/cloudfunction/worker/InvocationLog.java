package cloudfunction.worker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-invocation bookkeeping inside a worker. Finished entries older than the
 * retention window are pruned whenever a new invocation starts.
 */
public final class InvocationLog {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    public record Entry(String requestId, String function, Instant startedAt, Instant finishedAt, String outcome) {
        public boolean isFinished() {
            return finishedAt != null;
        }
    }

    private final Clock clock;
    private final Duration retention;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public InvocationLog() {
        this(Clock.systemUTC(), DEFAULT_RETENTION);
    }

    public InvocationLog(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    public synchronized void started(String requestId, String function) {
        prune();
        entries.put(requestId, new Entry(requestId, function, clock.instant(), null, null));
    }

    public synchronized void finished(String requestId, String outcome) {
        Entry e = entries.get(requestId);
        if (e != null) {
            entries.put(requestId, new Entry(e.requestId(), e.function(), e.startedAt(), clock.instant(), outcome));
        }
    }

    public synchronized int prune() {
        Instant cutoff = clock.instant().minus(retention);
        int before = entries.size();
        entries.values().removeIf(e -> e.isFinished() && e.finishedAt().isBefore(cutoff));
        return before - entries.size();
    }

    public synchronized List<Entry> running() {
        List<Entry> result = new ArrayList<>();
        for (Entry e : entries.values()) {
            if (!e.isFinished()) {
                result.add(e);
            }
        }
        return result;
    }

    public synchronized List<Entry> entries() {
        return new ArrayList<>(entries.values());
    }
}
