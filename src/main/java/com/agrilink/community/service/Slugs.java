package com.agrilink.community.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * URL slugs for tips and tip categories.
 */
final class Slugs {

    private static final int MAX_LENGTH = 200;

    private Slugs() {
    }

    /**
     * "Drip Irrigation: 101!" becomes "drip-irrigation-101".
     */
    static String slugify(String text) {
        String normalized = Normalizer.normalize(text == null ? "" : text, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (normalized.length() > MAX_LENGTH) {
            normalized = normalized.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return normalized.isEmpty() ? "item" : normalized;
    }

    /**
     * Slug of the text, suffixed -2, -3, ... until it is not taken.
     */
    static String uniqueSlug(String text, Predicate<String> taken) {
        String base = slugify(text);
        String candidate = base;
        int suffix = 2;
        while (taken.test(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }
}
