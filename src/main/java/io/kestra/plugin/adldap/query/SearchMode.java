package io.kestra.plugin.adldap.query;

public enum SearchMode {
    /** Base scope, the target entry only. */
    READ,
    /** Subtree below the target. */
    RECURSIVE,
    /** Immediate children of the target. */
    LISTING;

    /**
     * Resolves the mode from the orchestrator flags, {@code read} taking precedence over {@code recursive}.
     */
    public static SearchMode of(boolean read, boolean recursive) {
        if (read) {
            return READ;
        }
        return recursive ? RECURSIVE : LISTING;
    }
}
