package com.flagship.workforce_pay.common;

import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results plus the metadata a client needs to walk the rest.
 */
@Value
public class PagedResult<T> {
    List<T> items;
    PageInfo pagination;

    public static <T> PagedResult<T> of(List<T> items, Pagination request, long totalCount) {
        int totalPages = (int) ((totalCount + request.getLimit() - 1) / request.getLimit());
        PageInfo info = new PageInfo(
            request.getPage(),
            totalPages,
            totalCount,
            (long) request.getPage() * request.getLimit() < totalCount,
            request.getPage() > 1
        );
        return new PagedResult<>(List.copyOf(items), info);
    }

    public <R> PagedResult<R> map(Function<T, R> mapper) {
        return new PagedResult<>(items.stream().map(mapper).toList(), pagination);
    }

    @Value
    public static class PageInfo {
        int currentPage;
        int totalPages;
        long totalCount;
        boolean hasNext;
        boolean hasPrev;
    }
}
