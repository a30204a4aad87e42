package com.flagship.workforce_pay.common;

import com.flagship.workforce_pay.exception.ValidationException;
import lombok.Value;

/**
 * 1-based page request.
 */
@Value
public class Pagination {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    int page;
    int limit;

    /**
     * Builds a page request from optional query parameters.
     *
     * @throws ValidationException if page is below 1 or limit is outside [1, MAX_LIMIT]
     */
    public static Pagination of(Integer page, Integer limit) {
        int resolvedPage = page != null ? page : DEFAULT_PAGE;
        int resolvedLimit = limit != null ? limit : DEFAULT_LIMIT;

        if (resolvedPage < 1) {
            throw new ValidationException("page must be 1 or greater");
        }
        if (resolvedLimit < 1 || resolvedLimit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        return new Pagination(resolvedPage, resolvedLimit);
    }

    public static Pagination firstPage(int limit) {
        return of(DEFAULT_PAGE, limit);
    }

    public long getOffset() {
        return (long) (page - 1) * limit;
    }
}
