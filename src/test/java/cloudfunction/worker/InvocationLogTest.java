package cloudfunction.worker;

import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InvocationLogTest {

    /** Clock that only moves when told to. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    @DisplayName("finished entries past retention are pruned, running ones are kept")
    void prunesOnlyOldFinishedEntries() {
        MutableClock clock = new MutableClock();
        InvocationLog log = new InvocationLog(clock, Duration.ofMinutes(10));

        log.started("r1", "echo");
        log.finished("r1", "success");
        log.started("r2", "slow");
        clock.advance(Duration.ofMinutes(11));

        log.started("r3", "echo");

        assertEquals(2, log.entries().size());
        assertEquals(2, log.running().size());
        assertTrue(log.entries().stream().noneMatch(e -> e.requestId().equals("r1")));
    }

    @Test
    void finishRecordsOutcome() {
        InvocationLog log = new InvocationLog();
        log.started("r1", "echo");
        log.finished("r1", "error");
        log.finished("unknown", "success");

        InvocationLog.Entry e = log.entries().get(0);
        assertTrue(e.isFinished());
        assertEquals("error", e.outcome());
        assertTrue(log.running().isEmpty());
        assertEquals(0, log.prune());
    }
}
