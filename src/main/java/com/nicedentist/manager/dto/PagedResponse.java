package com.nicedentist.manager.dto;

import java.util.List;
import java.util.function.Function;

/** Wire form of {@link PagedResult}. */
public record PagedResponse<T>(
        List<T> data,
        int page,
        int pageSize,
        long total,
        int totalPages,
        boolean hasPreviousPage,
        boolean hasNextPage
) {

    public static <S, T> PagedResponse<T> from(PagedResult<S> result, Function<S, T> mapper) {
        PagedResult<T> mapped = result.map(mapper);
        return new PagedResponse<>(
                mapped.items(),
                mapped.page(),
                mapped.pageSize(),
                mapped.totalCount(),
                mapped.totalPages(),
                mapped.hasPreviousPage(),
                mapped.hasNextPage());
    }
}
