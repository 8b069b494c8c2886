package com.example.studio.security.exception;

/**
 * No valid principal for the request. Rendered as 401.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
