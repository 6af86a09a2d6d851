package dev.kappalib.dto;

import dev.kappalib.entity.Novel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NovelResponse {
    private String id;
    private String title;
    private String titleEn;
    private String author;
    private Integer yearStart;
    private Integer yearEnd;
    private String status;
    private String description;
    private String ageRating;
    private String coverUrl;
    private OffsetDateTime createdAt;

    public static NovelResponse from(Novel novel) {
        return NovelResponse.builder()
                .id(novel.getId())
                .title(novel.getTitle())
                .titleEn(novel.getTitleEn())
                .author(novel.getAuthor())
                .yearStart(novel.getYearStart())
                .yearEnd(novel.getYearEnd())
                .status(novel.getStatus())
                .description(novel.getDescription())
                .ageRating(novel.getAgeRating())
                .coverUrl(novel.getCoverUrl())
                .createdAt(novel.getCreatedAt())
                .build();
    }
}
