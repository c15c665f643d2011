package dev.univer.fintrack.service;

import dev.univer.fintrack.bot.BotCommands;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramWrapper extends TelegramLongPollingBot {

    private final BotProperties props;
    private final ApplicationEventPublisher publisher;

    @Override public String getBotUsername() { return props.getUsername(); }
    @Override public String getBotToken() { return props.getToken(); }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }

    public void installCommands() {
        List<BotCommand> commands = BotCommands.menu();
        SetMyCommands set = new SetMyCommands();
        set.setCommands(commands);
        set.setScope(new BotCommandScopeDefault());
        try { execute(set); log.info("Bot commands installed: {}", commands.size()); }
        catch (TelegramApiException e) { log.warn("Failed to set bot commands", e); }
    }
}
