package com.meridian.platformapi.api;

/** Offset/limit bounds shared by the listing endpoints. */
final class Paging {

    static final String TOTAL_COUNT_HEADER = "X-Total-Count";
    static final int MAX_LIMIT = 100;

    private Paging() {
        // utility class
    }

    static void validate(int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
    }
}
