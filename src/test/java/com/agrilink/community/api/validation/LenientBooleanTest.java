package com.agrilink.community.api.validation;

import com.agrilink.community.exception.FieldValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LenientBoolean Tests")
class LenientBooleanTest {

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", "1", "yes", "Y", " on "})
    @DisplayName("parse - Truthy spellings")
    void parse_True(String value) {
        assertThat(LenientBoolean.parse(value, "is_featured")).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "0", "no", "n", "OFF"})
    @DisplayName("parse - Falsy spellings")
    void parse_False(String value) {
        assertThat(LenientBoolean.parse(value, "is_featured")).isFalse();
    }

    @Test
    @DisplayName("parse - Absent or blank means not sent")
    void parse_Absent() {
        assertThat(LenientBoolean.parse(null, "is_pinned")).isNull();
        assertThat(LenientBoolean.parse("  ", "is_pinned")).isNull();
    }

    @Test
    @DisplayName("parse - Anything else is a field error on the given field")
    void parse_Invalid() {
        assertThatThrownBy(() -> LenientBoolean.parse("maybe", "is_pinned"))
                .isInstanceOf(FieldValidationException.class)
                .satisfies(e -> assertThat(((FieldValidationException) e).getFieldErrors()).containsKey("is_pinned"));
    }
}
