package dev.univer.fintrack.model;

/**
 * Category ownership partition. The global scope is stored as owner id {@code 0}.
 */
public record CategoryScope(long ownerId) {

    public static final CategoryScope GLOBAL = new CategoryScope(0L);

    public static CategoryScope of(long contributorId) {
        if (contributorId == 0L) {
            throw new IllegalArgumentException("Contributor id 0 is reserved for the global scope");
        }
        return new CategoryScope(contributorId);
    }
}
