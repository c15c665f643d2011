package dev.univer.fintrack.dialogue;

import dev.univer.fintrack.exception.AlreadyExistsException;
import dev.univer.fintrack.exception.SessionExpiredException;
import dev.univer.fintrack.exception.ValidationException;
import dev.univer.fintrack.model.CategoryScope;
import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.model.ExpenseScope;
import dev.univer.fintrack.service.CategoryRegistry;
import dev.univer.fintrack.service.RecordStore;
import dev.univer.fintrack.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Per-contributor state machines for the multi-message commands.
 *
 * <p>Expense entry: {@code AWAITING_AMOUNT -> AWAITING_CATEGORY -> idle}. Category naming,
 * category deletion and the clear confirmation are one prompt followed by one commit step.
 * A store failure leaves the session where it was so the user can simply repeat the message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DialogueEngine {
    private final DialogueSessionStore sessions;
    private final CategoryRegistry categoryRegistry;
    private final RecordStore store;

    public Optional<DialogueStep> activeStep(long contributorId, FlowKind flow) {
        return sessions.find(contributorId, flow).map(DialogueSession::step);
    }

    // ===================== EXPENSE ENTRY =====================

    /** Starts over even if an earlier entry was left unfinished. */
    public void beginExpenseEntry(long contributorId) {
        sessions.start(contributorId, DialogueStep.AWAITING_AMOUNT);
    }

    /**
     * @return the categories to offer for the next step
     * @throws ValidationException when the text is not a positive number; the step is unchanged
     */
    public List<String> submitAmount(long contributorId, String text) {
        DialogueSession session = require(contributorId, DialogueStep.AWAITING_AMOUNT);
        BigDecimal amount = ParseUtil.parseAmount(text);
        if (amount == null) {
            throw new ValidationException("Please enter a valid number. Try again:");
        }
        List<String> categories = categoryRegistry.listCategories(CategoryScope.GLOBAL);
        sessions.save(contributorId, session.withAmount(amount, DialogueStep.AWAITING_CATEGORY, sessions.now()));
        return categories;
    }

    public Expense selectCategory(long contributorId, String category, String displayName, LocalDate today) {
        DialogueSession session = require(contributorId, DialogueStep.AWAITING_CATEGORY);
        if (category == null || category.isBlank()) {
            throw new ValidationException("Please choose a category.");
        }
        Expense saved = store.createExpense(contributorId, session.pendingAmount(), category, today, displayName);
        sessions.clear(contributorId, FlowKind.EXPENSE_ENTRY);
        log.info("Expense {} saved: contributor={}, amount={}, category={}",
                 saved.getId(), contributorId, saved.getAmount(), category);
        return saved;
    }

    /** Drops every open flow of the contributor. Safe to call at any time. */
    public boolean cancel(long contributorId) {
        return sessions.clearAll(contributorId);
    }

    // ===================== CATEGORY NAME =====================

    public void beginCategoryName(long contributorId) {
        sessions.start(contributorId, DialogueStep.AWAITING_CATEGORY_NAME);
    }

    /**
     * @return the trimmed name that was added
     * @throws ValidationException for an unusable name; the prompt stays open
     * @throws AlreadyExistsException when the name is taken; the flow ends without changes
     */
    public String submitCategoryName(long contributorId, String text) {
        require(contributorId, DialogueStep.AWAITING_CATEGORY_NAME);
        try {
            String added = categoryRegistry.addCategory(CategoryScope.GLOBAL, text);
            sessions.clear(contributorId, FlowKind.CATEGORY_NAME);
            return added;
        } catch (AlreadyExistsException e) {
            sessions.clear(contributorId, FlowKind.CATEGORY_NAME);
            throw e;
        }
    }

    // ===================== CATEGORY DELETION =====================

    /** @return the categories to choose from; empty means nothing to delete and no flow was opened */
    public List<String> beginCategoryDeletion(long contributorId) {
        List<String> categories = categoryRegistry.listCategories(CategoryScope.GLOBAL);
        if (categories.isEmpty()) return categories;
        sessions.start(contributorId, DialogueStep.AWAITING_DELETION_CHOICE);
        return categories;
    }

    public void confirmCategoryDeletion(long contributorId, String name) {
        require(contributorId, DialogueStep.AWAITING_DELETION_CHOICE);
        categoryRegistry.removeCategory(CategoryScope.GLOBAL, name);
        sessions.clear(contributorId, FlowKind.CATEGORY_DELETION);
    }

    // ===================== CLEAR CONFIRMATION =====================

    public void beginClear(long contributorId, ExpenseScope scope) {
        Instant now = sessions.now();
        sessions.save(contributorId, DialogueSession.start(DialogueStep.AWAITING_CLEAR_CONFIRMATION, now).withClearScope(scope, now));
    }

    /** @return the scope that was wiped */
    public ExpenseScope confirmClear(long contributorId) {
        DialogueSession session = require(contributorId, DialogueStep.AWAITING_CLEAR_CONFIRMATION);
        ExpenseScope scope = session.pendingClear();
        long deleted = store.deleteExpenses(scope);
        sessions.clear(contributorId, FlowKind.CLEAR_CONFIRMATION);
        log.info("Contributor {} cleared {} expenses ({})", contributorId, deleted, scope.isAll() ? "all" : "own");
        return scope;
    }

    private DialogueSession require(long contributorId, DialogueStep step) {
        return sessions.find(contributorId, step.flow())
                       .filter(s -> s.step() == step)
                       .orElseThrow(() -> new SessionExpiredException(contributorId, step.flow()));
    }
}
