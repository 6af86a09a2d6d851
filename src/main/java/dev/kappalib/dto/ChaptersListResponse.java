package dev.kappalib.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChaptersListResponse {
    private List<ChapterSummary> chapters;
    private String novelId;
    private int count;

    public static ChaptersListResponse of(String novelId, List<ChapterSummary> chapters) {
        return new ChaptersListResponse(chapters, novelId, chapters.size());
    }
}
