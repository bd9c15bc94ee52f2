package com.agrilink.community.api.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FormParams Tests")
class FormParamsTest {

    @Test
    @DisplayName("either - One spelling is used, values bound to both are not doubled")
    void either() {
        assertThat(FormParams.either(List.of("My plot"), List.of("My plot"))).containsExactly("My plot");
        assertThat(FormParams.either(null, List.of("b", "c"))).containsExactly("b", "c");
        assertThat(FormParams.either(List.of("a"), null)).containsExactly("a");
        assertThat(FormParams.either(null, null)).isEmpty();
    }

    @Test
    @DisplayName("tags - Splits commas, trims and drops blanks and duplicates")
    void tags() {
        assertThat(FormParams.tags(List.of("maize, pests", " ", "pests", "irrigation"), null))
                .containsExactly("maize", "pests", "irrigation");
        assertThat(FormParams.tags(null, List.of("soil,", "mulch")))
                .containsExactly("soil", "mulch");
    }

    @Test
    @DisplayName("tags - Not sent at all is null, sent empty is an empty list")
    void tags_Absent() {
        assertThat(FormParams.tags(null, null)).isNull();
        assertThat(FormParams.tags(List.of(""), null)).isEmpty();
    }
}
