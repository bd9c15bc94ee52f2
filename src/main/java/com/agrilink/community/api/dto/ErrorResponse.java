package com.agrilink.community.api.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of every non-2xx response. Field validation failures land under
 * {@code details.fieldErrors}, keyed by the snake_case request field.
 *
 * @author AgriLink Team
 */
@Getter
@Setter
@NoArgsConstructor
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(Integer status, String error, String message, String path) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public ErrorResponse addDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }
}
