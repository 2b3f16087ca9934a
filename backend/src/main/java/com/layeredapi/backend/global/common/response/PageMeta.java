package com.layeredapi.backend.global.common.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PageMeta(
        @JsonProperty("current_page") int currentPage,
        @JsonProperty("per_page") int perPage,
        @JsonProperty("total") long total,
        @JsonProperty("total_pages") int totalPages
) {

    public static PageMeta of(int page, int perPage, long total) {
        int totalPages = (int) ((total + perPage - 1) / perPage);
        return new PageMeta(page, perPage, total, totalPages);
    }
}
