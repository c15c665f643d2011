package dev.univer.fintrack.bot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.univer.fintrack.dialogue.DialogueEngine;
import dev.univer.fintrack.dialogue.DialogueSessionStore;
import dev.univer.fintrack.dialogue.DialogueStep;
import dev.univer.fintrack.dialogue.FlowKind;
import dev.univer.fintrack.exception.StoreUnavailableException;
import dev.univer.fintrack.model.CategoryScope;
import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.model.ExpenseScope;
import dev.univer.fintrack.report.ReportPaginator;
import dev.univer.fintrack.service.BotProperties;
import dev.univer.fintrack.service.CategoryRegistry;
import dev.univer.fintrack.service.ChatTransport;
import dev.univer.fintrack.service.ChoiceOption;
import dev.univer.fintrack.service.RecordStore;
import dev.univer.fintrack.service.ReportService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExpenseCommandHandlerTest {

    private static final long CHAT = 500L;
    private static final long ALICE = 42L;

    @Mock
    private RecordStore store;
    @Mock
    private CategoryRegistry categoryRegistry;
    @Mock
    private ChatTransport transport;

    private DialogueEngine dialogue;
    private ExpenseCommandHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-04-15T10:00:00Z"), ZoneOffset.UTC);
        BotProperties props = new BotProperties();
        ReportPaginator paginator = new ReportPaginator(props);
        dialogue = new DialogueEngine(new DialogueSessionStore(clock, props), categoryRegistry, store);
        handler = new ExpenseCommandHandler(dialogue, categoryRegistry, new ReportService(store, paginator, clock),
                                            paginator, transport, clock);
        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of("Food", "Transport"));
        when(store.createExpense(anyLong(), any(), any(), any(), any())).thenAnswer(inv -> Expense.builder()
                .id(1L)
                .contributorId(inv.getArgument(0))
                .amount(inv.getArgument(1))
                .category(inv.getArgument(2))
                .occurredOn("04/15/2025")
                .displayName(inv.getArgument(4))
                .build());
    }

    private void send(String text) {
        handler.onMessage(new InboundMessage(CHAT, ALICE, "alice", text));
    }

    private void tap(String token) {
        handler.onCallback(new InboundCallback(CHAT, ALICE, "alice", "q-1", token));
    }

    @Test
    void addAmountAndCategoryRecordsOneExpense() {
        send("/add");
        send("12.50");
        tap("cat_Food");

        verify(store).createExpense(ALICE, new BigDecimal("12.50"), "Food", LocalDate.of(2025, 4, 15), "alice");
        verify(transport).deliver(CHAT, "Enter the expense amount:");
        verify(transport).presentChoice(CHAT, "Choose a category:",
                                        List.of(ChoiceOption.category("Food"), ChoiceOption.category("Transport")));
        verify(transport).acknowledge("q-1");
        verify(transport).deliver(CHAT, "Saved: 12.50$ — Food");
        assertThat(dialogue.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).isEmpty();
    }

    @Test
    void invalidAmountKeepsWaitingForAmount() {
        send("/add");
        send("abc");

        verify(transport).deliver(CHAT, "Please enter a valid number. Try again:");
        assertThat(dialogue.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).contains(DialogueStep.AWAITING_AMOUNT);
    }

    @Test
    void categoryTapWithoutEntrySavesNothing() {
        tap("cat_Food");

        verify(transport).deliver(CHAT, "This entry is no longer active. Start again with /add.");
        verify(store, never()).createExpense(anyLong(), any(), any(), any(), any());
    }

    @Test
    void plainTextOutsideAnyDialogueIsIgnored() {
        send("hello there");

        verifyNoInteractions(transport);
    }

    @Test
    void cancelDropsPendingEntry() {
        send("/add");
        send("/cancel");
        send("12");

        verify(transport).deliver(CHAT, "Operation cancelled.");
        verify(transport, never()).presentChoice(eq(CHAT), eq("Choose a category:"), any());
    }

    @Test
    void monthWithImpossibleMonthIsRejectedBeforeQuerying() {
        send("/month 13/2025");

        verify(transport).deliver(CHAT, ExpenseCommandHandler.MONTH_INVALID);
        verifyNoInteractions(store);
    }

    @Test
    void monthWithoutArgumentShowsUsage() {
        send("/month");
        send("/month 04/2025 extra");

        verify(transport, times(2)).deliver(CHAT, ExpenseCommandHandler.MONTH_USAGE);
        verifyNoInteractions(store);
    }

    @Test
    void monthWithoutRecordsSaysSo() {
        when(store.listExpensesIn(YearMonth.of(2025, 4))).thenReturn(List.of());

        send("/month 04/2025");

        verify(transport).deliver(CHAT, "No expenses found for 04/2025.");
    }

    @Test
    void everyMenuCommandGetsAnAnswer() {
        for (BotCommands.Entry entry : BotCommands.ALL) {
            clearInvocations(transport);

            send("/" + entry.command());

            assertThat(mockingDetails(transport).getInvocations()).as(entry.usage()).isNotEmpty();
        }
    }

    @Test
    void commandAddressedToBotByMentionIsRecognised() {
        send("/add@fintrack_bot");

        verify(transport).deliver(CHAT, "Enter the expense amount:");
    }

    @Test
    void confirmClearNeedsPriorWarning() {
        send("/confirmclear");

        verify(transport).deliver(CHAT, "Nothing to confirm. Send /clear first.");
        verify(store, never()).deleteExpenses(any());
    }

    @Test
    void clearMineWipesOnlyOwnRecords() {
        send("/clearmine");
        send("/confirmclear");

        verify(store).deleteExpenses(ExpenseScope.contributor(ALICE));
        verify(transport).deliver(CHAT, "Your expenses cleared.");
    }

    @Test
    void clearAllAfterConfirmation() {
        send("/clear");
        send("/confirmclear");

        verify(store).deleteExpenses(ExpenseScope.ALL);
        verify(transport).deliver(CHAT, "All expenses cleared.");
    }

    @Test
    void addCategoryByName() {
        when(categoryRegistry.addCategory(CategoryScope.GLOBAL, "Pets")).thenReturn("Pets");

        send("/add_category");
        send("Pets");

        verify(transport).deliver(CHAT, "Category 'Pets' added for everyone!");
        assertThat(dialogue.activeStep(ALICE, FlowKind.CATEGORY_NAME)).isEmpty();
    }

    @Test
    void deleteCategoryOffersChoicesAndRemovesSelected() {
        send("/delete_category");
        tap("del_Transport");

        verify(transport).presentChoice(CHAT, "Choose a category to delete:",
                                        List.of(ChoiceOption.deletion("Food"), ChoiceOption.deletion("Transport")));
        verify(categoryRegistry).removeCategory(CategoryScope.GLOBAL, "Transport");
        verify(transport).deliver(CHAT, "Category 'Transport' deleted for everyone.");
    }

    @Test
    void deleteCategoryWithEmptyRegistry() {
        when(categoryRegistry.listCategories(CategoryScope.GLOBAL)).thenReturn(List.of());

        send("/delete_category");

        verify(transport).deliver(CHAT, "No categories to delete.");
        assertThat(dialogue.activeStep(ALICE, FlowKind.CATEGORY_DELETION)).isEmpty();
    }

    @Test
    void categoriesAreNumbered() {
        send("/categories");

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(transport).deliver(eq(CHAT), text.capture());
        assertThat(text.getValue()).startsWith("All available categories:\n\n1. Food\n2. Transport\n");
    }

    @Test
    void storeOutageIsReportedWithoutLosingTheEntry() {
        when(store.createExpense(anyLong(), any(), any(), any(), any()))
                .thenThrow(new StoreUnavailableException("createExpense", new IllegalStateException("down")));

        send("/add");
        send("7");
        tap("cat_Food");

        verify(transport).deliver(CHAT, ExpenseCommandHandler.GENERIC_FAILURE);
        assertThat(dialogue.activeStep(ALICE, FlowKind.EXPENSE_ENTRY)).contains(DialogueStep.AWAITING_CATEGORY);
    }
}
