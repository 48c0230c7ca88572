package com.ivamare.exchange.store;

/**
 * Page request for list queries.
 *
 * @param limit Maximum number of records
 * @param offset Records to skip
 */
public record Pagination(int limit, int offset) {

    public Pagination {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }

    public static Pagination firstPage(int limit) {
        return new Pagination(limit, 0);
    }
}
