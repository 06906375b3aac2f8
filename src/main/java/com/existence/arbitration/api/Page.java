package com.existence.arbitration.api;

import java.util.List;

/**
 * A page of results from a paginated query.
 *
 * @param content       the content of this page
 * @param totalElements total number of elements across all pages
 * @param pageNumber    the current page number (0-based)
 * @param pageSize      the requested page size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    public int numberOfElements() {
        return content.size();
    }

    /**
     * Slices an already filtered and ordered list into the requested page.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int total = all.size();
        int fromIndex = Math.min(request.offset(), total);
        int toIndex = Math.min(request.offset() + request.limit(), total);
        return new Page<>(all.subList(fromIndex, toIndex), total, request.pageNumber(), request.limit());
    }
}
