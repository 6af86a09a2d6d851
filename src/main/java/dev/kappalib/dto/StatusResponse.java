package dev.kappalib.dto;

public record StatusResponse(String status, String database) {
}
