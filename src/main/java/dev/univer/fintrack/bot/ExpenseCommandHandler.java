package dev.univer.fintrack.bot;

import dev.univer.fintrack.dialogue.DialogueEngine;
import dev.univer.fintrack.dialogue.DialogueStep;
import dev.univer.fintrack.dialogue.FlowKind;
import dev.univer.fintrack.exception.AlreadyExistsException;
import dev.univer.fintrack.exception.SessionExpiredException;
import dev.univer.fintrack.exception.StoreUnavailableException;
import dev.univer.fintrack.exception.ValidationException;
import dev.univer.fintrack.model.CategoryScope;
import dev.univer.fintrack.model.Expense;
import dev.univer.fintrack.model.ExpenseScope;
import dev.univer.fintrack.report.ReportPaginator;
import dev.univer.fintrack.service.CategoryRegistry;
import dev.univer.fintrack.service.ChatTransport;
import dev.univer.fintrack.service.ChoiceOption;
import dev.univer.fintrack.service.ReportService;
import dev.univer.fintrack.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command surface of the bot. Commands are matched first; plain text goes to whichever
 * dialogue is waiting for it and is ignored otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpenseCommandHandler {

    private final DialogueEngine dialogue;
    private final CategoryRegistry categoryRegistry;
    private final ReportService reportService;
    private final ReportPaginator paginator;
    private final ChatTransport transport;
    private final Clock clock;

    // ====== Commands ======
    private static final String MENTION_OPT = "(?:@\\w+)?";

    private static final Pattern START           = command("start");
    private static final Pattern HELP            = command("help");
    private static final Pattern ADD             = command("add");
    private static final Pattern REPORT          = command("report");
    private static final Pattern PREV_MONTH      = command("prev_month");
    private static final Pattern MONTH           = command("month");
    private static final Pattern CLEAR           = command("clear");
    private static final Pattern CLEAR_MINE      = command("clearmine");
    private static final Pattern CONFIRM_CLEAR   = command("confirmclear");
    private static final Pattern CATEGORIES      = command("categories");
    private static final Pattern ADD_CATEGORY    = command("add_category");
    private static final Pattern DELETE_CATEGORY = command("delete_category");
    private static final Pattern CANCEL          = command("cancel");

    static final String GENERIC_FAILURE = "Something went wrong, please try again later.";
    static final String MONTH_USAGE = "Use the format: /month MM/YYYY (for example, /month 04/2025)";
    static final String MONTH_INVALID = "Invalid format. Use: /month MM/YYYY";

    private static Pattern command(String name) {
        return Pattern.compile("^/" + name + MENTION_OPT + "(?:\\s+(?<args>.*))?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    public void onMessage(InboundMessage in) {
        String text = in.text() == null ? "" : in.text().trim();
        guarded(in.chatId(), in.contributorId(), () -> {
            if (text.startsWith("/")) {
                handleCommand(in, text);
            } else {
                handleDialogueText(in, text);
            }
        });
    }

    public void onCallback(InboundCallback in) {
        transport.acknowledge(in.queryId());
        guarded(in.chatId(), in.contributorId(), () -> {
            String category = ChoiceOption.textOf(in.token(), ChoiceOption.CATEGORY_PREFIX);
            if (category != null) {
                Expense saved = dialogue.selectCategory(in.contributorId(), category, in.displayName(), LocalDate.now(clock));
                transport.deliver(in.chatId(), "Saved: " + ParseUtil.formatMoney(saved.getAmount()) + "$ — " + saved.getCategory());
                return;
            }
            String doomed = ChoiceOption.textOf(in.token(), ChoiceOption.DELETE_PREFIX);
            if (doomed != null) {
                dialogue.confirmCategoryDeletion(in.contributorId(), doomed);
                transport.deliver(in.chatId(), "Category '" + doomed + "' deleted for everyone.");
                return;
            }
            log.debug("Ignoring callback with unknown token from contributor {}", in.contributorId());
        });
    }

    private void handleCommand(InboundMessage in, String text) {
        long chatId = in.chatId();
        long who = in.contributorId();

        if (START.matcher(text).matches()) {
            transport.deliver(chatId, "Hi! Use /add to record an expense.\nSee /help for all commands.");
            return;
        }
        if (HELP.matcher(text).matches()) { transport.deliver(chatId, BotCommands.helpText()); return; }

        if (ADD.matcher(text).matches()) {
            dialogue.beginExpenseEntry(who);
            transport.deliver(chatId, "Enter the expense amount:");
            return;
        }
        if (CANCEL.matcher(text).matches()) {
            dialogue.cancel(who);
            transport.deliver(chatId, "Operation cancelled.");
            return;
        }

        if (REPORT.matcher(text).matches()) { deliverAll(chatId, reportService.currentReport()); return; }
        if (PREV_MONTH.matcher(text).matches()) { deliverAll(chatId, reportService.previousMonthReport()); return; }
        Matcher mm = MONTH.matcher(text);
        if (mm.matches()) {
            String args = mm.group("args");
            if (args == null || args.isBlank() || args.trim().split("\\s+").length != 1) {
                transport.deliver(chatId, MONTH_USAGE);
                return;
            }
            YearMonth month = ParseUtil.parseMonthArg(args);
            if (month == null) {
                transport.deliver(chatId, MONTH_INVALID);
                return;
            }
            deliverAll(chatId, reportService.monthReport(month));
            return;
        }

        if (CLEAR.matcher(text).matches()) {
            dialogue.beginClear(who, ExpenseScope.ALL);
            transport.deliver(chatId, "⚠️ Warning! This deletes the expenses of ALL users. Continue? Send /confirmclear to confirm.");
            return;
        }
        if (CLEAR_MINE.matcher(text).matches()) {
            dialogue.beginClear(who, ExpenseScope.contributor(who));
            transport.deliver(chatId, "⚠️ This deletes all of your own expenses. Send /confirmclear to confirm.");
            return;
        }
        if (CONFIRM_CLEAR.matcher(text).matches()) {
            ExpenseScope scope = dialogue.confirmClear(who);
            transport.deliver(chatId, scope.isAll() ? "All expenses cleared." : "Your expenses cleared.");
            return;
        }

        if (CATEGORIES.matcher(text).matches()) { deliverAll(chatId, renderCategories()); return; }
        if (ADD_CATEGORY.matcher(text).matches()) {
            dialogue.beginCategoryName(who);
            transport.deliver(chatId, "Enter the new category name:");
            return;
        }
        if (DELETE_CATEGORY.matcher(text).matches()) {
            List<String> categories = dialogue.beginCategoryDeletion(who);
            if (categories.isEmpty()) {
                transport.deliver(chatId, "No categories to delete.");
                return;
            }
            transport.presentChoice(chatId, "Choose a category to delete:",
                                    categories.stream().map(ChoiceOption::deletion).toList());
            return;
        }
        log.debug("Unknown command from contributor {}: {}", who, text);
    }

    private void handleDialogueText(InboundMessage in, String text) {
        long who = in.contributorId();
        Optional<DialogueStep> expenseStep = dialogue.activeStep(who, FlowKind.EXPENSE_ENTRY);
        if (expenseStep.isPresent() && expenseStep.get() == DialogueStep.AWAITING_AMOUNT) {
            List<String> categories = dialogue.submitAmount(who, text);
            transport.presentChoice(in.chatId(), "Choose a category:",
                                    categories.stream().map(ChoiceOption::category).toList());
            return;
        }
        if (dialogue.activeStep(who, FlowKind.CATEGORY_NAME).isPresent()) {
            String added = dialogue.submitCategoryName(who, text);
            transport.deliver(in.chatId(), "Category '" + added + "' added for everyone!");
        }
    }

    private List<String> renderCategories() {
        List<String> categories = categoryRegistry.listCategories(CategoryScope.GLOBAL);
        List<String> items = new ArrayList<>();
        for (int i = 0; i < categories.size(); i++) {
            items.add((i + 1) + ". " + categories.get(i) + "\n");
        }
        items.add("\nUse /add_category to add or /delete_category to remove a category.");
        return paginator.paginate("All available categories:\n\n", "All available categories (continued):\n\n", items);
    }

    private void guarded(long chatId, long contributorId, Runnable action) {
        try {
            action.run();
        } catch (ValidationException e) {
            transport.deliver(chatId, e.getMessage());
        } catch (AlreadyExistsException e) {
            transport.deliver(chatId, "Category '" + e.getName() + "' already exists.");
        } catch (SessionExpiredException e) {
            transport.deliver(chatId, expiredText(e.getFlow()));
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while handling contributor {}", contributorId, e);
            transport.deliver(chatId, GENERIC_FAILURE);
        }
    }

    static String expiredText(FlowKind flow) {
        return switch (flow) {
            case EXPENSE_ENTRY -> "This entry is no longer active. Start again with /add.";
            case CATEGORY_NAME -> "No category is being added. Start again with /add_category.";
            case CATEGORY_DELETION -> "This selection is no longer active. Start again with /delete_category.";
            case CLEAR_CONFIRMATION -> "Nothing to confirm. Send /clear first.";
        };
    }

    private void deliverAll(long chatId, List<String> messages) {
        for (String m : messages) transport.deliver(chatId, m);
    }
}
