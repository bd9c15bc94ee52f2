package com.agrilink.community.service;

import org.springframework.data.domain.Sort;

import java.util.Locale;

/**
 * Sort orders offered by the tip and success story listings.
 * Ties fall back to the newest id.
 */
public enum ListingSort {
    POPULAR("likesCount"),
    VIEWS("viewsCount"),
    LATEST("createdAt");

    private final String property;

    ListingSort(String property) {
        this.property = property;
    }

    public Sort toSort() {
        return Sort.by(Sort.Order.desc(property), Sort.Order.desc("id"));
    }

    /**
     * Parse a sort name; unknown or missing names mean LATEST.
     */
    public static ListingSort fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LATEST;
        }
        try {
            return ListingSort.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LATEST;
        }
    }
}
