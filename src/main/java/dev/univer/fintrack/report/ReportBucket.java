package dev.univer.fintrack.report;

import dev.univer.fintrack.model.Expense;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Expenses sharing one grouping key, in input order, with their running total. */
@Getter
public class ReportBucket<K> {
    private final K key;
    private final List<Expense> expenses = new ArrayList<>();
    private BigDecimal total = BigDecimal.ZERO;

    public ReportBucket(K key) {
        this.key = key;
    }

    void add(Expense expense) {
        expenses.add(expense);
        total = total.add(expense.getAmount());
    }

    public List<Expense> getExpenses() {
        return Collections.unmodifiableList(expenses);
    }
}
