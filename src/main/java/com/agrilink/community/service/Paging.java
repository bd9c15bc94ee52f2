package com.agrilink.community.service;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Locale;

/**
 * Helpers shared by the paged listings. Pages are 1-based on the wire.
 */
final class Paging {

    private Paging() {
    }

    static Pageable page(Integer page, int size, Sort sort) {
        int number = page == null || page < 1 ? 0 : page - 1;
        return PageRequest.of(number, size, sort);
    }

    /**
     * Lower-case LIKE pattern for a search term, or null when there is nothing to search for.
     */
    static String likePattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        return "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
