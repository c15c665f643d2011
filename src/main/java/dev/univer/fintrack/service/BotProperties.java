package dev.univer.fintrack.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "bot")
@Getter @Setter
public class BotProperties {
    private String username;
    private String token;
    // false keeps the bot from registering with Telegram (local runs, tests)
    private boolean pollingEnabled = true;
    // zone used to stamp "today" on new expenses and to resolve the current month
    private String zoneId = "UTC";
    // hard per-message limit for report segments
    private int maxMessageLength = 3500;
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);
}
