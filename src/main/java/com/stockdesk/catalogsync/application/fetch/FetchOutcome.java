package com.stockdesk.catalogsync.application.fetch;

/**
 * Why a fetch loop stopped.
 */
public enum FetchOutcome {
    LAST_PAGE("last page reached", false),
    NO_NEXT_PAGE("no next page", false),
    LOOP_DETECTED("no progress detected", true),
    ITERATION_CAP_REACHED("iteration cap reached", true),
    TOO_MANY_ERRORS("too many errors", true),
    CANCELLED("cancelled", true);

    private final String description;
    private final boolean partial;

    FetchOutcome(String description, boolean partial) {
        this.description = description;
        this.partial = partial;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True when the loop stopped before reaching the end of the catalog.
     */
    public boolean isPartial() {
        return partial;
    }
}
