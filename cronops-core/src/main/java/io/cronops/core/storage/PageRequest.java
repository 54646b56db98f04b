package io.cronops.core.storage;

public record PageRequest(int page, int limit) {
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public PageRequest {
        page = Math.max(1, page);
        limit = Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    public static PageRequest first(int limit) {
        return new PageRequest(1, limit);
    }

    public int offset() {
        return (page - 1) * limit;
    }
}
