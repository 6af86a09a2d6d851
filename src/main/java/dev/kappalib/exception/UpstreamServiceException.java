package dev.kappalib.exception;

import lombok.Getter;

/**
 * Failure of an external collaborator (object storage, chat API).
 */
@Getter
public class UpstreamServiceException extends RuntimeException {

    private final String service;

    public UpstreamServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }
}
