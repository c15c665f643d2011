package dev.univer.fintrack.config;

import dev.univer.fintrack.service.TelegramWrapper;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bot", name = "polling-enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBotConfig {

    private final TelegramWrapper telegramWrapper;

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    @Bean
    public InitializingBean registerBot(TelegramBotsApi api) {
        return () -> {
            try {
                api.registerBot(telegramWrapper);
                // command menu is only installed once the bot is registered
                telegramWrapper.installCommands();
            } catch (TelegramApiException e) {
                throw new IllegalStateException("Failed to register Telegram bot", e);
            }
        };
    }
}
