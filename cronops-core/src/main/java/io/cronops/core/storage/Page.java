package io.cronops.core.storage;

import java.util.List;

public record Page<T>(List<T> items, int page, int limit, long total) {
    public Page {
        items = items == null ? List.of() : List.copyOf(items);
        page = Math.max(1, page);
        limit = Math.max(1, limit);
        total = Math.max(0, total);
    }

    public int totalPages() {
        return (int) ((total + limit - 1) / limit);
    }
}
