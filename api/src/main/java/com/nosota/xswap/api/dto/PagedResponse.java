package com.nosota.xswap.api.dto;

import java.util.List;

/**
 * Page of results returned by list endpoints.
 *
 * @param content        Items of the current page
 * @param page           Page number (0-indexed)
 * @param size           Requested page size
 * @param totalElements  Total number of items across all pages
 */
public record PagedResponse<T>(
        List<T> content,
        int page,
        int size,
        long totalElements
) {
}
