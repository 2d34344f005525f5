package com.minichat.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Pagination(
        long total,
        int offset,
        int limit,
        @JsonProperty("has_more") boolean hasMore
) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    public static Pagination of(long total, int offset, int limit, int returned) {
        return new Pagination(total, offset, limit, (long) offset + returned < total);
    }

    /** 与历史查询一致：缺省 50，限制在 1..100。 */
    public static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    public static int clampOffset(Integer offset) {
        return offset == null ? 0 : Math.max(0, offset);
    }
}
