package dev.univer.fintrack.dialogue;

/** Independent multi-step conversations a contributor can have open at the same time. */
public enum FlowKind {
    EXPENSE_ENTRY,
    CATEGORY_NAME,
    CATEGORY_DELETION,
    CLEAR_CONFIRMATION
}
