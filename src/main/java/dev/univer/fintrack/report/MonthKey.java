package dev.univer.fintrack.report;

import dev.univer.fintrack.util.ParseUtil;

import java.time.YearMonth;
import java.util.Comparator;

/**
 * Month bucket key. Records whose date cannot be read share the {@link #UNKNOWN} key,
 * which sorts after every real month.
 */
public record MonthKey(YearMonth month) implements Comparable<MonthKey> {

    public static final MonthKey UNKNOWN = new MonthKey(null);

    private static final Comparator<MonthKey> ORDER =
            Comparator.comparing(MonthKey::month, Comparator.nullsLast(Comparator.naturalOrder()));

    public static MonthKey of(YearMonth month) {
        return new MonthKey(month);
    }

    public boolean isUnknown() {
        return month == null;
    }

    /** {@code MM/YYYY}, or {@code unknown}. */
    public String label() {
        return isUnknown() ? "unknown" : month.format(ParseUtil.MONTH_KEY);
    }

    @Override
    public int compareTo(MonthKey other) {
        return ORDER.compare(this, other);
    }
}
