package com.layeredapi.backend.global.common.response;

/**
 * Normalized pagination input: page is 1-based, limit is clamped to [1, 100].
 */
public record PageQuery(int page, int limit) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (page < 1) {
            page = DEFAULT_PAGE;
        }
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
        if (limit > MAX_LIMIT) {
            limit = MAX_LIMIT;
        }
    }

    public static PageQuery of(Integer page, Integer limit) {
        return new PageQuery(
                page != null ? page : DEFAULT_PAGE,
                limit != null ? limit : DEFAULT_LIMIT
        );
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }

    public PageMeta toMeta(long total) {
        return PageMeta.of(page, limit, total);
    }
}
