package dev.univer.fintrack.dialogue;

import dev.univer.fintrack.service.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open dialogue sessions keyed by (contributor, flow). Every operation is a single atomic map
 * call, so different contributors never wait on each other. Sessions idle longer than the
 * configured timeout read as absent and are dropped by {@link #evictIdle()}.
 */
@Component
@Slf4j
public class DialogueSessionStore {

    public record SessionKey(long contributorId, FlowKind flow) {}

    private final Map<SessionKey, DialogueSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;

    @Autowired
    public DialogueSessionStore(Clock clock, BotProperties props) {
        this(clock, props.getSessionIdleTimeout());
    }

    DialogueSessionStore(Clock clock, Duration idleTimeout) {
        if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("sessionIdleTimeout must be positive");
        }
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    /** Opens the step's flow, replacing whatever session that flow had. */
    public DialogueSession start(long contributorId, DialogueStep step) {
        DialogueSession session = DialogueSession.start(step, clock.instant());
        sessions.put(new SessionKey(contributorId, step.flow()), session);
        return session;
    }

    public Optional<DialogueSession> find(long contributorId, FlowKind flow) {
        SessionKey key = new SessionKey(contributorId, flow);
        DialogueSession session = sessions.get(key);
        if (session == null) return Optional.empty();
        if (isIdle(session, clock.instant())) {
            sessions.remove(key, session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public void save(long contributorId, DialogueSession session) {
        sessions.put(new SessionKey(contributorId, session.flow()), session);
    }

    public Instant now() {
        return clock.instant();
    }

    public void clear(long contributorId, FlowKind flow) {
        sessions.remove(new SessionKey(contributorId, flow));
    }

    /** @return whether any flow was open */
    public boolean clearAll(long contributorId) {
        boolean any = false;
        for (FlowKind flow : FlowKind.values()) {
            any |= sessions.remove(new SessionKey(contributorId, flow)) != null;
        }
        return any;
    }

    public int evictIdle() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<SessionKey, DialogueSession> e : sessions.entrySet()) {
            if (isIdle(e.getValue(), now) && sessions.remove(e.getKey(), e.getValue())) evicted++;
        }
        if (evicted > 0) log.info("Evicted {} idle dialogue sessions", evicted);
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    private boolean isIdle(DialogueSession session, Instant now) {
        return session.touchedAt().plus(idleTimeout).isBefore(now);
    }
}
