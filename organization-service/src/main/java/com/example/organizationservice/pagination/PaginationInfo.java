package com.example.organizationservice.pagination;

/**
 * Requested page window. {@code perPage} of {@code null} or {@code 0} means
 * "no limit": the whole result set is returned as a single page.
 */
public record PaginationInfo(int page, Integer perPage) {

    public PaginationInfo {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (perPage != null && perPage < 0) {
            throw new IllegalArgumentException("perPage must be >= 0, got " + perPage);
        }
    }

    public static PaginationInfo unpaged() {
        return new PaginationInfo(1, null);
    }

    public boolean isLimited() {
        return perPage != null && perPage > 0;
    }

    public long offset() {
        return isLimited() ? (long) (page - 1) * perPage : 0L;
    }

    /**
     * True when the window starts past any row a query can address, so the
     * page is necessarily empty.
     */
    public boolean isBeyondAddressableRows() {
        return offset() > Integer.MAX_VALUE;
    }
}
