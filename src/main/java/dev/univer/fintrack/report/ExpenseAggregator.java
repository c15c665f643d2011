package dev.univer.fintrack.report;

import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.util.ParseUtil;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Grouping and totals over expense lists. Stored dates are parsed here; text only comes back
 * at formatting time.
 */
public final class ExpenseAggregator {

    private ExpenseAggregator() {
    }

    public static Optional<YearMonth> monthOf(Expense e) {
        return ParseUtil.parseDate(e.getOccurredOn()).map(YearMonth::from);
    }

    /** Sum of the expenses dated inside {@code period}; zero when none are. */
    public static BigDecimal totalsForPeriod(List<Expense> records, YearMonth period) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Expense e : records) {
            if (monthOf(e).filter(period::equals).isPresent()) sum = sum.add(e.getAmount());
        }
        return sum;
    }

    public static BigDecimal totalsForYear(List<Expense> records, int year) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Expense e : records) {
            Optional<LocalDate> date = ParseUtil.parseDate(e.getOccurredOn());
            if (date.isPresent() && date.get().getYear() == year) sum = sum.add(e.getAmount());
        }
        return sum;
    }

    /** Month buckets in ascending (year, month) order, unreadable dates last. */
    public static SortedMap<MonthKey, ReportBucket<MonthKey>> groupByMonth(List<Expense> records) {
        SortedMap<MonthKey, ReportBucket<MonthKey>> buckets = new TreeMap<>();
        for (Expense e : records) {
            MonthKey key = monthOf(e).map(MonthKey::of).orElse(MonthKey.UNKNOWN);
            buckets.computeIfAbsent(key, ReportBucket::new).add(e);
        }
        return buckets;
    }

    /** Category totals in order of first appearance. */
    public static Map<String, BigDecimal> groupByCategory(List<Expense> records) {
        return runningSums(records, Expense::getCategory);
    }

    /** Totals per contributor display name in order of first appearance. */
    public static Map<String, BigDecimal> groupByContributor(List<Expense> records) {
        return runningSums(records, Expense::getDisplayName);
    }

    public static YearMonth previousMonth(YearMonth month) {
        return month.getMonthValue() == 1
               ? YearMonth.of(month.getYear() - 1, 12)
               : YearMonth.of(month.getYear(), month.getMonthValue() - 1);
    }

    private static Map<String, BigDecimal> runningSums(List<Expense> records, Function<Expense, String> key) {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        for (Expense e : records) {
            sums.merge(key.apply(e), e.getAmount(), BigDecimal::add);
        }
        return sums;
    }
}
