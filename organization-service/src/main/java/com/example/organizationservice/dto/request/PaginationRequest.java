package com.example.organizationservice.dto.request;

import com.example.organizationservice.pagination.PaginationInfo;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query parameters selecting a page. {@code perPage=0} returns every row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaginationRequest {

    public static final int MAX_PER_PAGE = 100;

    @Min(value = 1, message = "page must be at least 1")
    private int page = 1;

    @Min(value = 0, message = "perPage must not be negative")
    @Max(value = MAX_PER_PAGE, message = "perPage must be at most " + MAX_PER_PAGE)
    private int perPage = 10;

    public PaginationInfo toPaginationInfo() {
        return new PaginationInfo(page, perPage);
    }
}
