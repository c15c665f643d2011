package dev.univer.fintrack.dialogue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.univer.fintrack.exception.AlreadyExistsException;
import dev.univer.fintrack.exception.SessionExpiredException;
import dev.univer.fintrack.exception.StoreUnavailableException;
import dev.univer.fintrack.exception.ValidationException;
import dev.univer.fintrack.model.CategoryScope;
import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.model.ExpenseScope;
import dev.univer.fintrack.service.CategoryRegistry;
import dev.univer.fintrack.service.RecordStore;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DialogueEngineTest {

    private static final long ALICE = 42L;
    private static final LocalDate TODAY = LocalDate.of(2025, 4, 15);

    @Mock
    private CategoryRegistry categoryRegistry;

    @Mock
    private RecordStore store;

    private DialogueSessionStore sessions;
    private DialogueEngine engine;

    @BeforeEach
    void setUp() {
        sessions = new DialogueSessionStore(new MutableClock(Instant.parse("2025-04-15T10:00:00Z")), Duration.ofMinutes(30));
        engine = new DialogueEngine(sessions, categoryRegistry, store);
    }

    @ParameterizedTest
    @ValueSource(strings = {"12.50", "3", "0.99", " 7.5 ", "1000000", "4,20"})
    void validAmountMovesToCategoryStep(String text) {
        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of("Food", "Other"));
        engine.beginExpenseEntry(ALICE);

        List<String> offered = engine.submitAmount(ALICE, text);

        assertThat(offered).containsExactly("Food", "Other");
        DialogueSession session = sessions.find(ALICE, FlowKind.EXPENSE_ENTRY).orElseThrow();
        assertThat(session.step()).isEqualTo(DialogueStep.AWAITING_CATEGORY);
        assertThat(session.pendingAmount()).isEqualByComparingTo(new BigDecimal(text.trim().replace(',', '.')));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "", "12.5.1", "twelve", "-5", "0", "1e3", "NaN", "12.555", "123456789012345678901234"})
    void invalidAmountKeepsAmountStep(String text) {
        engine.beginExpenseEntry(ALICE);

        assertThatThrownBy(() -> engine.submitAmount(ALICE, text)).isInstanceOf(ValidationException.class);

        assertThat(engine.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).contains(DialogueStep.AWAITING_AMOUNT);
    }

    @Test
    void selectCategoryPersistsAndClearsSession() {
        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of("Food"));
        when(store.createExpense(anyLong(), any(), anyString(), any(), anyString()))
                .thenAnswer(inv -> Expense.builder().id(1L).contributorId(inv.getArgument(0))
                                          .amount(inv.getArgument(1)).category(inv.getArgument(2))
                                          .occurredOn("04/15/2025").displayName(inv.getArgument(4)).build());
        engine.beginExpenseEntry(ALICE);
        engine.submitAmount(ALICE, "12.50");

        Expense saved = engine.selectCategory(ALICE, "Food", "alice", TODAY);

        assertThat(saved.getAmount()).isEqualByComparingTo("12.50");
        verify(store).createExpense(eq(ALICE), eq(new BigDecimal("12.50")), eq("Food"), eq(TODAY), eq("alice"));
        assertThat(engine.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).isEmpty();
    }

    @Test
    void selectCategoryWithoutSessionFailsInsteadOfSavingZero() {
        assertThatThrownBy(() -> engine.selectCategory(ALICE, "Food", "alice", TODAY))
                .isInstanceOf(SessionExpiredException.class);

        verify(store, never()).createExpense(anyLong(), any(), anyString(), any(), anyString());
    }

    @Test
    void selectCategoryWhileStillAwaitingAmountFails() {
        engine.beginExpenseEntry(ALICE);

        assertThatThrownBy(() -> engine.selectCategory(ALICE, "Food", "alice", TODAY))
                .isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void storeFailureKeepsSessionForRetry() {
        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of("Food"));
        when(store.createExpense(anyLong(), any(), anyString(), any(), anyString()))
                .thenThrow(new StoreUnavailableException("createExpense", new RuntimeException("down")));
        engine.beginExpenseEntry(ALICE);
        engine.submitAmount(ALICE, "8");

        assertThatThrownBy(() -> engine.selectCategory(ALICE, "Food", "alice", TODAY))
                .isInstanceOf(StoreUnavailableException.class);

        assertThat(engine.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).contains(DialogueStep.AWAITING_CATEGORY);
    }

    @Test
    void cancelIsIdempotent() {
        engine.beginExpenseEntry(ALICE);
        engine.beginCategoryName(ALICE);

        assertThat(engine.cancel(ALICE)).isTrue();
        assertThat(engine.cancel(ALICE)).isFalse();
        assertThat(engine.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).isEmpty();
        assertThat(engine.activeStep(ALICE, FlowKind.CATEGORY_NAME)).isEmpty();
    }

    @Test
    void reentryDiscardsPendingAmount() {
        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of("Food"));
        engine.beginExpenseEntry(ALICE);
        engine.submitAmount(ALICE, "99");

        engine.beginExpenseEntry(ALICE);

        assertThat(engine.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).contains(DialogueStep.AWAITING_AMOUNT);
    }

    @Test
    void blankCategoryNameKeepsPromptOpen() {
        when(categoryRegistry.addCategory(CategoryScope.GLOBAL, "  "))
                .thenThrow(new ValidationException("Category name cannot be empty."));
        engine.beginCategoryName(ALICE);

        assertThatThrownBy(() -> engine.submitCategoryName(ALICE, "  ")).isInstanceOf(ValidationException.class);

        assertThat(engine.activeStep(ALICE, FlowKind.CATEGORY_NAME)).contains(DialogueStep.AWAITING_CATEGORY_NAME);
    }

    @Test
    void duplicateCategoryNameEndsFlow() {
        when(categoryRegistry.addCategory(CategoryScope.GLOBAL, "Food")).thenThrow(new AlreadyExistsException("Food"));
        engine.beginCategoryName(ALICE);

        assertThatThrownBy(() -> engine.submitCategoryName(ALICE, "Food")).isInstanceOf(AlreadyExistsException.class);

        assertThat(engine.activeStep(ALICE, FlowKind.CATEGORY_NAME)).isEmpty();
    }

    @Test
    void categoryNameAddedAndFlowClosed() {
        when(categoryRegistry.addCategory(CategoryScope.GLOBAL, "Pets")).thenReturn("Pets");
        engine.beginCategoryName(ALICE);

        assertThat(engine.submitCategoryName(ALICE, "Pets")).isEqualTo("Pets");
        assertThat(engine.activeStep(ALICE, FlowKind.CATEGORY_NAME)).isEmpty();
    }

    @Test
    void deletionRequiresOpenSelection() {
        assertThatThrownBy(() -> engine.confirmCategoryDeletion(ALICE, "Food"))
                .isInstanceOf(SessionExpiredException.class);
        verify(categoryRegistry, never()).removeCategory(any(), anyString());

        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of("Food"));
        assertThat(engine.beginCategoryDeletion(ALICE)).containsExactly("Food");
        engine.confirmCategoryDeletion(ALICE, "Food");

        verify(categoryRegistry).removeCategory(CategoryScope.GLOBAL, "Food");
        assertThat(engine.activeStep(ALICE, FlowKind.CATEGORY_DELETION)).isEmpty();
    }

    @Test
    void clearNeedsConfirmationAndUsesRequestedScope() {
        assertThatThrownBy(() -> engine.confirmClear(ALICE)).isInstanceOf(SessionExpiredException.class);
        verify(store, never()).deleteExpenses(any());

        engine.beginClear(ALICE, ExpenseScope.contributor(ALICE));
        ExpenseScope wiped = engine.confirmClear(ALICE);

        assertThat(wiped).isEqualTo(ExpenseScope.contributor(ALICE));
        verify(store).deleteExpenses(ExpenseScope.contributor(ALICE));
        assertThat(engine.activeStep(ALICE, FlowKind.CLEAR_CONFIRMATION)).isEmpty();
    }
}
