package com.agrilink.community.exception;

/**
 * Exception thrown when credentials are rejected.
 *
 * @author AgriLink Team
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
