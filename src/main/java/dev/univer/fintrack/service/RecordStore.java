package dev.univer.fintrack.service;

import dev.univer.fintrack.exception.StoreUnavailableException;
import dev.univer.fintrack.model.Category;
import dev.univer.fintrack.model.CategoryScope;
import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.model.ExpenseScope;
import dev.univer.fintrack.repo.CategoryRepository;
import dev.univer.fintrack.repo.ExpenseRepository;
import dev.univer.fintrack.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.function.Supplier;

/**
 * CRUD over expenses and categories. Each call is its own unit of work; failures of the
 * persistence layer surface as {@link StoreUnavailableException}, never as an empty result.
 */
@Service
@RequiredArgsConstructor
public class RecordStore {
    private final ExpenseRepository expenseRepository;
    private final CategoryRepository categoryRepository;

    public Expense createExpense(long contributorId, BigDecimal amount, String category, LocalDate occurredOn, String displayName) {
        Expense expense = Expense.builder()
                                 .contributorId(contributorId)
                                 .amount(amount)
                                 .category(category)
                                 .occurredOn(ParseUtil.formatDate(occurredOn))
                                 .displayName(displayName)
                                 .build();
        return call("createExpense", () -> expenseRepository.save(expense));
    }

    /** All expenses, newest first. */
    public List<Expense> listExpenses() {
        return call("listExpenses", expenseRepository::findAllByOrderByIdDesc);
    }

    public List<Expense> listExpensesIn(YearMonth month) {
        String pattern = ParseUtil.monthPattern(month);
        return call("listExpensesIn", () -> expenseRepository.findAllByOccurredOnLikeOrderByIdDesc(pattern));
    }

    public long deleteExpenses(ExpenseScope scope) {
        if (scope.isAll()) {
            return call("deleteExpenses", () -> {
                long count = expenseRepository.count();
                expenseRepository.deleteAllInBatch();
                return count;
            });
        }
        return call("deleteExpenses", () -> expenseRepository.deleteAllByContributorId(scope.contributorId()));
    }

    public Category createCategory(CategoryScope scope, String name) {
        Category category = Category.builder()
                                    .ownerScope(scope.ownerId())
                                    .name(name)
                                    .build();
        return call("createCategory", () -> categoryRepository.save(category));
    }

    /** Inserts all names in one transaction; on failure none of them is kept. */
    public List<Category> createCategories(CategoryScope scope, List<String> names) {
        List<Category> categories = names.stream()
                                         .map(name -> Category.builder()
                                                              .ownerScope(scope.ownerId())
                                                              .name(name)
                                                              .build())
                                         .toList();
        return call("createCategories", () -> categoryRepository.saveAll(categories));
    }

    public long deleteCategory(CategoryScope scope, String name) {
        return call("deleteCategory", () -> categoryRepository.deleteAllByOwnerScopeAndName(scope.ownerId(), name));
    }

    /** Raw rows of one scope in insertion order, duplicates included. */
    public List<Category> listCategoryRows(CategoryScope scope) {
        return call("listCategoryRows", () -> categoryRepository.findAllByOwnerScopeOrderByIdAsc(scope.ownerId()));
    }

    public List<Category> listAllCategoryRows() {
        return call("listAllCategoryRows", categoryRepository::findAllByOrderByIdAsc);
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }
}
