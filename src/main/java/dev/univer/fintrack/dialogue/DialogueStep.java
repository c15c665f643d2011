package dev.univer.fintrack.dialogue;

/**
 * Non-idle states of every flow. A flow with no stored session is idle.
 */
public enum DialogueStep {
    AWAITING_AMOUNT(FlowKind.EXPENSE_ENTRY),
    AWAITING_CATEGORY(FlowKind.EXPENSE_ENTRY),
    AWAITING_CATEGORY_NAME(FlowKind.CATEGORY_NAME),
    AWAITING_DELETION_CHOICE(FlowKind.CATEGORY_DELETION),
    AWAITING_CLEAR_CONFIRMATION(FlowKind.CLEAR_CONFIRMATION);

    private final FlowKind flow;

    DialogueStep(FlowKind flow) {
        this.flow = flow;
    }

    public FlowKind flow() {
        return flow;
    }
}
