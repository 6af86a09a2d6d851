package dev.kappalib.dto;

import java.util.List;

public record NovelSearchResponse(List<NovelResponse> novels, String query) {
}
