package dev.univer.fintrack.exception;

import dev.univer.fintrack.dialogue.FlowKind;
import lombok.Getter;

/** A commit step arrived with no matching active session. */
@Getter
public class SessionExpiredException extends ExpenseBotException {
    private final long contributorId;
    private final FlowKind flow;

    public SessionExpiredException(long contributorId, FlowKind flow) {
        super("No active " + flow + " session for contributor " + contributorId);
        this.contributorId = contributorId;
        this.flow = flow;
    }
}
