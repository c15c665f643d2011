package dev.univer.fintrack.bot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.MaybeInaccessibleMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

/**
 * Turns Telegram updates into inbound messages and callbacks for {@link ExpenseCommandHandler}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpenseBot {

    private final ExpenseCommandHandler handler;

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update", e); }
    }

    private void handle(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery query = update.getCallbackQuery();
            // taps on old messages arrive as InaccessibleMessage, which still carries the chat
            MaybeInaccessibleMessage origin = query.getMessage();
            User from = query.getFrom();
            if (origin == null || from == null) return;
            handler.onCallback(new InboundCallback(origin.getChatId(), from.getId(), displayName(from),
                                                   query.getId(), query.getData()));
            return;
        }
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (!msg.hasText() || msg.getFrom() == null) return;
        handler.onMessage(new InboundMessage(msg.getChatId(), msg.getFrom().getId(), displayName(msg.getFrom()), msg.getText()));
    }

    static String displayName(User user) {
        String username = user.getUserName();
        return (username == null || username.isBlank()) ? user.getFirstName() : username;
    }
}
