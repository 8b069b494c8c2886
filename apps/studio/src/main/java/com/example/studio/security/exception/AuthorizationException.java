package com.example.studio.security.exception;

/**
 * Authenticated principal may not perform the request. Rendered as a generic 403;
 * the message is for logs only.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
