package dev.univer.fintrack.model;

/**
 * Which expenses a bulk deletion touches: one contributor's records or everything.
 */
public record ExpenseScope(Long contributorId) {

    public static final ExpenseScope ALL = new ExpenseScope(null);

    public static ExpenseScope contributor(long contributorId) {
        return new ExpenseScope(contributorId);
    }

    public boolean isAll() {
        return contributorId == null;
    }
}
