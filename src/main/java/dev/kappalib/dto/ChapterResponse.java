package dev.kappalib.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Full chapter with its optional translation source. {@code source} is null when the chapter has none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterResponse {
    private String id;
    private String novelId;
    private Integer chapterNum;
    private String title;
    private String titleEn;
    private String content;
    private SourceInfo source;
    private OffsetDateTime createdAt;

    public record SourceInfo(String name, String logoUrl) {
    }
}
