package com.agrilink.community.api.controller;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for multipart parameters that clients send either as {@code name} or {@code name[]}.
 */
final class FormParams {

    private FormParams() {
    }

    /**
     * Values of a repeated parameter under whichever spelling was bound. Spring binds
     * {@code name[]} values to {@code name} as well, so the two are never concatenated.
     *
     * @return The plain values when present, else the bracketed ones, else an empty list
     */
    static <T> List<T> either(List<T> plain, List<T> bracketed) {
        if (plain != null) {
            return new ArrayList<>(plain);
        }
        return bracketed != null ? new ArrayList<>(bracketed) : new ArrayList<>();
    }

    /**
     * Normalise tags given as repeated values and/or comma-separated strings.
     *
     * @return Trimmed, non-blank tags, or null when the parameter was not sent at all
     */
    static List<String> tags(List<String> plain, List<String> bracketed) {
        if (plain == null && bracketed == null) {
            return null;
        }
        return either(plain, bracketed).stream()
                .filter(value -> value != null)
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }
}
