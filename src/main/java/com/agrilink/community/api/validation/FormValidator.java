package com.agrilink.community.api.validation;

import com.agrilink.community.exception.FieldValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates form objects assembled from multipart parameters, which Spring MVC cannot bind
 * and validate by snake_case name.
 *
 * @author AgriLink Team
 */
@Component
public class FormValidator {

    private final Validator validator;

    public FormValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validate a form.
     *
     * @param form Form object
     * @param groups Validation groups (Default when empty)
     * @throws FieldValidationException listing every violated field, keyed by snake_case name
     */
    public void validate(Object form, Class<?>... groups) {
        Set<ConstraintViolation<Object>> violations = validator.validate(form, groups);
        if (violations.isEmpty()) {
            return;
        }
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (ConstraintViolation<Object> violation : violations) {
            fieldErrors.putIfAbsent(FieldNames.toSnakeCase(violation.getPropertyPath().toString()),
                    violation.getMessage());
        }
        throw new FieldValidationException(fieldErrors);
    }
}
