package dev.univer.fintrack.dialogue;

import dev.univer.fintrack.model.ExpenseScope;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * In-memory state of one open flow. Only the fields of the session's own flow are set.
 */
public record DialogueSession(DialogueStep step, BigDecimal pendingAmount, ExpenseScope pendingClear, Instant touchedAt) {

    public static DialogueSession start(DialogueStep step, Instant now) {
        return new DialogueSession(step, null, null, now);
    }

    public DialogueSession withAmount(BigDecimal amount, DialogueStep next, Instant now) {
        return new DialogueSession(next, amount, pendingClear, now);
    }

    public DialogueSession withClearScope(ExpenseScope scope, Instant now) {
        return new DialogueSession(step, pendingAmount, scope, now);
    }

    public FlowKind flow() {
        return step.flow();
    }
}
