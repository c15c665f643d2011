package dev.univer.fintrack.config;

import dev.univer.fintrack.service.BotProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(BotProperties props) {
        return Clock.system(ZoneId.of(props.getZoneId()));
    }
}
