package dev.kappalib.dto;

import java.time.OffsetDateTime;

public record SitemapItem(String id, OffsetDateTime createdAt) {
}
