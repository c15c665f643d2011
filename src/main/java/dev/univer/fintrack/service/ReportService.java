package dev.univer.fintrack.service;

import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.report.ExpenseAggregator;
import dev.univer.fintrack.report.MonthKey;
import dev.univer.fintrack.report.ReportBucket;
import dev.univer.fintrack.report.ReportLayout;
import dev.univer.fintrack.report.ReportPaginator;
import dev.univer.fintrack.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Builds report messages. Each returned string is one outbound message.
 */
@Service
@RequiredArgsConstructor
public class ReportService {
    private final RecordStore store;
    private final ReportPaginator paginator;
    private final Clock clock;

    /** Current month listing plus previous month, current month and current year totals. */
    public List<String> currentReport() {
        List<Expense> rows = store.listExpenses();
        if (rows.isEmpty()) {
            return List.of("No expenses yet. Try adding some with /add!");
        }
        YearMonth current = YearMonth.now(clock);
        YearMonth previous = ExpenseAggregator.previousMonth(current);
        SortedMap<MonthKey, ReportBucket<MonthKey>> byMonth = ExpenseAggregator.groupByMonth(rows);
        ReportBucket<MonthKey> currentBucket = byMonth.get(MonthKey.of(current));
        ReportBucket<MonthKey> previousBucket = byMonth.get(MonthKey.of(previous));

        List<String> messages = new ArrayList<>();
        if (currentBucket == null) {
            messages.add("Your expenses:\n\nNo expenses found for " + ReportLayout.title(current) + ".");
        } else {
            messages.addAll(paginate(ReportLayout.MONTH_LISTING, current, currentBucket.getExpenses()));
        }

        String summary = "📊 SUMMARY:\n\n"
                         + "💰 Expenses for " + ReportLayout.title(previous) + ": " + money(total(previousBucket)) + "\n"
                         + "💰 Expenses for " + ReportLayout.title(current) + ": " + money(total(currentBucket)) + "\n"
                         + "💰 Total expenses for " + current.getYear() + ": "
                         + money(ExpenseAggregator.totalsForYear(rows, current.getYear()));
        messages.add(summary);
        return messages;
    }

    /** Detailed report of one month, or a single "nothing found" message. */
    public List<String> monthReport(YearMonth month) {
        List<Expense> rows = store.listExpensesIn(month);
        if (rows.isEmpty()) {
            return List.of("No expenses found for " + month.format(ParseUtil.MONTH_KEY) + ".");
        }
        return detailed(month, rows);
    }

    public List<String> previousMonthReport() {
        YearMonth previous = ExpenseAggregator.previousMonth(YearMonth.now(clock));
        List<Expense> rows = store.listExpensesIn(previous);
        if (rows.isEmpty()) {
            return List.of("No expenses found for " + ReportLayout.title(previous) + ".");
        }
        return detailed(previous, rows);
    }

    private List<String> detailed(YearMonth month, List<Expense> rows) {
        List<String> messages = new ArrayList<>(paginate(ReportLayout.DETAILED, month, rows));

        StringBuilder sb = new StringBuilder();
        sb.append("💰 Total for ").append(ReportLayout.title(month)).append(": ")
          .append(money(ExpenseAggregator.totalsForPeriod(rows, month))).append("\n\n");
        sb.append("📊 Expenses by category:\n");
        for (Map.Entry<String, BigDecimal> e : ExpenseAggregator.groupByCategory(rows).entrySet()) {
            sb.append("• ").append(e.getKey()).append(": ").append(money(e.getValue())).append("\n");
        }
        sb.append("\n👥 Expenses by contributor:\n");
        for (Map.Entry<String, BigDecimal> e : ExpenseAggregator.groupByContributor(rows).entrySet()) {
            sb.append("• @").append(e.getKey()).append(": ").append(money(e.getValue())).append("\n");
        }
        messages.add(sb.toString().trim());
        return messages;
    }

    private List<String> paginate(ReportLayout layout, YearMonth month, List<Expense> expenses) {
        List<String> lines = expenses.stream().map(ReportService::line).toList();
        return paginator.paginate(layout.header(month), layout.continuationHeader(month), lines);
    }

    static String line(Expense e) {
        return e.getOccurredOn() + ": " + money(e.getAmount()) + " — " + e.getCategory()
               + " (added by: @" + e.getDisplayName() + ")\n";
    }

    private static BigDecimal total(ReportBucket<MonthKey> bucket) {
        return bucket == null ? BigDecimal.ZERO : bucket.getTotal();
    }

    private static String money(BigDecimal x) {
        return ParseUtil.formatMoney(x) + "$";
    }
}
