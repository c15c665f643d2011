package dev.univer.fintrack.bot;

import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Commands the bot understands, shared by the Telegram command menu and {@code /help}.
 */
public final class BotCommands {

    public record Entry(String command, String usage, String description) {}

    public static final List<Entry> ALL = List.of(
            new Entry("start", "/start", "start using the bot"),
            new Entry("help", "/help", "list all commands"),
            new Entry("add", "/add", "add a new expense"),
            new Entry("report", "/report", "expenses of the current month"),
            new Entry("prev_month", "/prev_month", "detailed report for the previous month"),
            new Entry("month", "/month MM/YYYY", "report for a specific month"),
            new Entry("clear", "/clear", "delete all expense records (asks for /confirmclear)"),
            new Entry("clearmine", "/clearmine", "delete your own expense records (asks for /confirmclear)"),
            new Entry("confirmclear", "/confirmclear", "confirm a pending /clear or /clearmine"),
            new Entry("categories", "/categories", "list categories"),
            new Entry("add_category", "/add_category", "add a new category"),
            new Entry("delete_category", "/delete_category", "delete a category"),
            new Entry("cancel", "/cancel", "cancel the current operation")
    );

    private BotCommands() {
    }

    public static List<BotCommand> menu() {
        return ALL.stream()
                  .map(e -> new BotCommand("/" + e.command(), e.description()))
                  .toList();
    }

    public static String helpText() {
        return ALL.stream()
                  .map(e -> e.usage() + " - " + e.description())
                  .collect(Collectors.joining("\n", "Available commands:\n", ""));
    }
}
