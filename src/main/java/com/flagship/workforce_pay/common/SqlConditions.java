package com.flagship.workforce_pay.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates parameterized WHERE predicates.
 *
 * Listings and statistics build their filters through the same instance type so
 * that a count, a page and an aggregate over the same filters always agree.
 */
public final class SqlConditions {

    private final List<String> predicates = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    public SqlConditions add(String predicate, Object param) {
        predicates.add(predicate);
        params.add(param);
        return this;
    }

    /**
     * Adds the predicate only when the parameter is present.
     */
    public SqlConditions addIfPresent(String predicate, Object param) {
        if (param != null) {
            add(predicate, param);
        }
        return this;
    }

    /**
     * @return " WHERE a AND b" or an empty string when no predicate was added
     */
    public String toWhereClause() {
        if (predicates.isEmpty()) {
            return "";
        }
        return " WHERE " + String.join(" AND ", predicates);
    }

    public Object[] params() {
        return params.toArray();
    }

    /**
     * Parameters followed by extra trailing values (LIMIT/OFFSET).
     */
    public Object[] paramsWith(Object... trailing) {
        List<Object> all = new ArrayList<>(params);
        Collections.addAll(all, trailing);
        return all.toArray();
    }
}
