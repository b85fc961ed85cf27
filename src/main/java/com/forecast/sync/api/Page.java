package com.forecast.sync.api;

import java.util.List;

/**
 * A window of results plus the total number of matching rows.
 *
 * @param content       rows of this window, copied
 * @param totalElements rows matching the query across all windows
 * @param offset        offset of the first row
 * @param limit         requested window size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int offset, int limit) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) offset + content.size() < totalElements;
    }

    public int totalPages() {
        return limit == 0 ? 0 : (int) Math.ceil((double) totalElements / limit);
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), 0, request.offset(), request.limit());
    }
}
