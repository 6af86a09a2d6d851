package dev.kappalib.exception;

/**
 * Avatar payload that is not a decodable JPEG or PNG image.
 */
public class UnsupportedImageException extends RuntimeException {

    public UnsupportedImageException(String message) {
        super(message);
    }

    public UnsupportedImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
