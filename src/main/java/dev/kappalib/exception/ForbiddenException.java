package dev.kappalib.exception;

/**
 * Missing or wrong credential: a profile secret token or the webhook secret.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
