package com.flagship.workforce_pay.common;

import com.flagship.workforce_pay.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaginationTest {

    @Test
    @DisplayName("Defaults to page 1 with 10 items")
    void defaults() {
        Pagination pagination = Pagination.of(null, null);

        assertEquals(1, pagination.getPage());
        assertEquals(10, pagination.getLimit());
        assertEquals(0, pagination.getOffset());
    }

    @Test
    @DisplayName("Offset follows page and limit")
    void offset() {
        assertEquals(40, Pagination.of(3, 20).getOffset());
    }

    @Test
    @DisplayName("Out of range page or limit is rejected")
    void bounds() {
        assertThrows(ValidationException.class, () -> Pagination.of(0, 10));
        assertThrows(ValidationException.class, () -> Pagination.of(1, 0));
        assertThrows(ValidationException.class, () -> Pagination.of(1, 101));
        assertDoesNotThrow(() -> Pagination.of(1, 100));
    }

    @Test
    @DisplayName("Page metadata is derived from the total count")
    void pageInfo() {
        PagedResult<String> middle = PagedResult.of(List.of("a", "b"), Pagination.of(2, 2), 5);

        assertEquals(3, middle.getPagination().getTotalPages());
        assertEquals(5, middle.getPagination().getTotalCount());
        assertTrue(middle.getPagination().isHasNext());
        assertTrue(middle.getPagination().isHasPrev());

        PagedResult<String> last = PagedResult.of(List.of("e"), Pagination.of(3, 2), 5);
        assertFalse(last.getPagination().isHasNext());

        PagedResult<String> none = PagedResult.of(List.of(), Pagination.of(null, null), 0);
        assertEquals(0, none.getPagination().getTotalPages());
        assertFalse(none.getPagination().isHasNext());
        assertFalse(none.getPagination().isHasPrev());
    }

    @Test
    @DisplayName("Mapping keeps the page metadata")
    void mapKeepsMetadata() {
        PagedResult<Integer> mapped = PagedResult.of(List.of("a", "bb"), Pagination.of(1, 2), 4).map(String::length);

        assertEquals(List.of(1, 2), mapped.getItems());
        assertEquals(2, mapped.getPagination().getTotalPages());
    }

    @Test
    @DisplayName("Conditions skip absent parameters")
    void sqlConditions() {
        SqlConditions conditions = new SqlConditions()
            .addIfPresent("a.user_id = ?", 5L)
            .addIfPresent("a.status = ?", null);
        DateRange.of(LocalDate.of(2024, 1, 1), null).applyTo(conditions, "a.date");

        assertEquals(" WHERE a.user_id = ? AND a.date >= ?", conditions.toWhereClause());
        assertArrayEquals(new Object[] {5L, LocalDate.of(2024, 1, 1)}, conditions.params());
        assertArrayEquals(new Object[] {5L, LocalDate.of(2024, 1, 1), 10, 0L}, conditions.paramsWith(10, 0L));
        assertEquals("", new SqlConditions().toWhereClause());
    }

    @Test
    @DisplayName("A range that ends before it starts is rejected")
    void invertedRange() {
        assertThrows(ValidationException.class, () ->
            DateRange.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
    }
}
