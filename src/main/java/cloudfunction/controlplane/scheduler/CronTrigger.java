package cloudfunction.controlplane.scheduler;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Cron trigger over six fields: {@code month day day_of_week hour minute second}.
 *
 * <p>Each field accepts {@code *}, {@code *}{@code /n}, {@code a}, {@code a-b}, {@code a-b/n}
 * and comma separated lists of those. {@code day_of_week} takes {@code mon..sun} or
 * {@code 0..6} with 0 = Monday.
 *
 * <p>Omitted fields: those more significant than the least significant given field
 * match everything, the rest match only their minimum. {@code day_of_week} defaults to
 * {@code *}. So {@code {hour: 2}} fires daily at 02:00:00.
 */
public final class CronTrigger {

    static final List<String> FIELD_ORDER = List.of("month", "day", "day_of_week", "hour", "minute", "second");

    private static final Map<String, int[]> RANGES = Map.of(
            "month", new int[]{1, 12},
            "day", new int[]{1, 31},
            "day_of_week", new int[]{0, 6},
            "hour", new int[]{0, 23},
            "minute", new int[]{0, 59},
            "second", new int[]{0, 59});

    private static final List<String> DAY_NAMES = List.of("mon", "tue", "wed", "thu", "fri", "sat", "sun");
    private static final int SEARCH_YEARS = 5;

    private final Map<String, String> expressions;
    private final BitSet months;
    private final BitSet days;
    private final BitSet daysOfWeek;
    private final BitSet hours;
    private final BitSet minutes;
    private final BitSet seconds;

    private CronTrigger(Map<String, String> expressions) {
        this.expressions = expressions;
        this.months = parseField("month", expressions.get("month"));
        this.days = parseField("day", expressions.get("day"));
        this.daysOfWeek = parseField("day_of_week", expressions.get("day_of_week"));
        this.hours = parseField("hour", expressions.get("hour"));
        this.minutes = parseField("minute", expressions.get("minute"));
        this.seconds = parseField("second", expressions.get("second"));
    }

    /**
     * @throws IllegalArgumentException for unknown field names or malformed expressions
     */
    public static CronTrigger of(Map<String, String> fields) {
        for (String name : fields.keySet()) {
            if (!RANGES.containsKey(name)) {
                throw new IllegalArgumentException("unknown cron field: " + name);
            }
        }
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("cron needs at least one field");
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        int remaining = fields.size();
        boolean pastLastGiven = false;
        for (String name : FIELD_ORDER) {
            String given = fields.get(name);
            if (given != null) {
                resolved.put(name, given.trim());
                remaining--;
                pastLastGiven = remaining == 0;
            } else if (pastLastGiven && !name.equals("day_of_week")) {
                resolved.put(name, String.valueOf(RANGES.get(name)[0]));
            } else {
                resolved.put(name, "*");
            }
        }
        return new CronTrigger(resolved);
    }

    /**
     * Next fire time strictly after {@code after}, or empty if none within a few years.
     */
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        ZonedDateTime t = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        int limitYear = after.getYear() + SEARCH_YEARS;
        while (t.getYear() <= limitYear) {
            if (!months.get(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!days.get(t.getDayOfMonth()) || !daysOfWeek.get(t.getDayOfWeek().getValue() - 1)) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.get(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(t.getMinute())) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            if (!seconds.get(t.getSecond())) {
                t = t.plusSeconds(1);
                continue;
            }
            return Optional.of(t);
        }
        return Optional.empty();
    }

    public Map<String, String> expressions() {
        return Map.copyOf(expressions);
    }

    private static BitSet parseField(String name, String expression) {
        int[] range = RANGES.get(name);
        BitSet bits = new BitSet(range[1] + 1);
        for (String part : expression.split(",")) {
            String p = part.trim().toLowerCase(Locale.ROOT);
            if (p.isEmpty()) {
                throw new IllegalArgumentException("empty entry in " + name + ": " + expression);
            }
            int step = 1;
            int slash = p.indexOf('/');
            if (slash >= 0) {
                step = parseNumber(name, p.substring(slash + 1));
                if (step <= 0) {
                    throw new IllegalArgumentException("step must be positive in " + name + ": " + expression);
                }
                p = p.substring(0, slash);
            }
            int from;
            int to;
            if (p.equals("*")) {
                from = range[0];
                to = range[1];
            } else {
                int dash = p.indexOf('-');
                if (dash > 0) {
                    from = parseValue(name, p.substring(0, dash));
                    to = parseValue(name, p.substring(dash + 1));
                } else {
                    if (slash >= 0) {
                        throw new IllegalArgumentException("step needs * or a range in " + name + ": " + expression);
                    }
                    from = parseValue(name, p);
                    to = from;
                }
            }
            if (from < range[0] || to > range[1] || from > to) {
                throw new IllegalArgumentException("value out of range for " + name + ": " + expression);
            }
            for (int v = from; v <= to; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int parseValue(String name, String token) {
        if (name.equals("day_of_week")) {
            int idx = DAY_NAMES.indexOf(token);
            if (idx >= 0) {
                return idx;
            }
        }
        return parseNumber(name, token);
    }

    private static int parseNumber(String name, String token) {
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + name + ": " + token, e);
        }
    }

    @Override
    public String toString() {
        return "CronTrigger" + expressions;
    }
}
