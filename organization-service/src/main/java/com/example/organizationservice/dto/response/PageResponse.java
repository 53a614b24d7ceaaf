package com.example.organizationservice.dto.response;

import com.example.organizationservice.pagination.Page;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;

/**
 * Paginated list envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private List<T> items;
    private long totalItems;
    private long totalPages;
    private int page;
    private int perPage;
    private boolean hasPrev;
    private boolean hasNext;

    public static <E, T> PageResponse<T> from(Page<E> page, Function<? super E, ? extends T> mapper) {
        Page<T> mapped = page.map(mapper);
        return PageResponse.<T>builder()
                .items(mapped.items())
                .totalItems(mapped.total())
                .totalPages(mapped.pages())
                .page(mapped.page())
                .perPage(mapped.perPage() == null ? 0 : mapped.perPage())
                .hasPrev(mapped.hasPrev())
                .hasNext(mapped.hasNext())
                .build();
    }
}
