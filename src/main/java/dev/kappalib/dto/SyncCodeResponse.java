package dev.kappalib.dto;

/**
 * @param expiresAt RFC 3339 timestamp
 */
public record SyncCodeResponse(String syncCode, String expiresAt) {
}
