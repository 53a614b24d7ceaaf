package com.example.organizationservice.pagination;

import java.util.List;
import java.util.function.Function;

/**
 * One page of query results together with the total number of matching rows.
 *
 * @param items   rows of this page
 * @param total   rows matching the query regardless of pagination
 * @param page    1-based page number
 * @param perPage page size; {@code null} or {@code 0} when unlimited
 */
public record Page<T>(List<T> items, long total, int page, Integer perPage) {

    public Page {
        items = List.copyOf(items);
    }

    public long pages() {
        if (perPage == null || perPage == 0) {
            return total > 0 ? 1 : 0;
        }
        return (total + perPage - 1) / perPage;
    }

    public boolean hasPrev() {
        return page > 1;
    }

    public boolean hasNext() {
        return page < pages();
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new Page<>(mapped, total, page, perPage);
    }
}
