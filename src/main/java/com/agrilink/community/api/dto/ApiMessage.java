package com.agrilink.community.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plain acknowledgement body, e.g. {"message": "Logged out successfully"}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiMessage {

    private String message;
}
