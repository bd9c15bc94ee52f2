package com.agrilink.community.api.validation;

import jakarta.validation.groups.Default;

/**
 * Validation group for constraints that only apply when a resource is created
 * (required fields that are optional on partial updates).
 */
public interface OnCreate extends Default {
}
