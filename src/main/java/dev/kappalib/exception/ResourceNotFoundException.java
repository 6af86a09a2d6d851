package dev.kappalib.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * Unknown novel, chapter, profile or comment. The message is an i18n key
 * resolved by {@link GlobalExceptionHandler}.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String field;
    private final Object value;

    public ResourceNotFoundException(String resource, String field, Object value) {
        super("error." + resource.toLowerCase(Locale.ROOT).replace(' ', '_') + "_not_found");
        this.resource = resource;
        this.field = field;
        this.value = value;
    }

    /**
     * Not-found with an explicit message key, for cases where the lookup value must not be echoed.
     */
    public ResourceNotFoundException(String messageKey) {
        super(messageKey);
        this.resource = null;
        this.field = null;
        this.value = null;
    }
}
