package dev.univer.fintrack.service;

import dev.univer.fintrack.dialogue.DialogueSessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionEvictionService {

    private final DialogueSessionStore sessions;

    // Run every minute to drop dialogues nobody finished
    @Scheduled(cron = "0 * * * * *")
    public void tick() {
        sessions.evictIdle();
    }
}
