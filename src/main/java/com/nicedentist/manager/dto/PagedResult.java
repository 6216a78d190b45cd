package com.nicedentist.manager.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

public record PagedResult<T>(List<T> items, int page, int pageSize, long totalCount) {

    public static final int MAX_PAGE_SIZE = 100;

    public int totalPages() {
        return pageSize <= 0 ? 0 : (int) Math.ceil((double) totalCount / pageSize);
    }

    public boolean hasPreviousPage() {
        return page > 1;
    }

    public boolean hasNextPage() {
        return page < totalPages();
    }

    public <R> PagedResult<R> map(Function<T, R> mapper) {
        return new PagedResult<>(items.stream().map(mapper).toList(), page, pageSize, totalCount);
    }

    /** Converts a zero-based Spring Data page into the one-based form used by the API. */
    public static <T> PagedResult<T> of(Page<T> page) {
        return new PagedResult<>(page.getContent(), page.getNumber() + 1, page.getSize(), page.getTotalElements());
    }

    public static int normalizePage(int page) {
        return Math.max(1, page);
    }

    public static int normalizePageSize(int pageSize) {
        return Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
    }
}
