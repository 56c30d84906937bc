package com.company.powersense.domain.enums;

import com.company.powersense.exception.InvalidQueryException;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public String sql() {
        return name();
    }

    /**
     * Case-insensitive parse; null means the default, descending.
     */
    public static SortOrder fromString(String order) {
        if (order == null || order.isBlank()) {
            return DESC;
        }
        try {
            return SortOrder.valueOf(order.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("order must be 'asc' or 'desc'");
        }
    }
}
