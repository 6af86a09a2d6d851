package dev.kappalib.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterSummary {
    private String id;
    private Integer chapterNum;
    private String title;
    private String titleEn;
}
