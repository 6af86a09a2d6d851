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
public class NovelsPage {
    private List<NovelResponse> novels;
    private int page;
    private int pageSize;
    private long totalCount;
    private int totalPages;

    public static NovelsPage of(List<NovelResponse> novels, int page, int pageSize, long totalCount) {
        return NovelsPage.builder()
                .novels(novels)
                .page(page)
                .pageSize(pageSize)
                .totalCount(totalCount)
                .totalPages(totalPages(totalCount, pageSize))
                .build();
    }

    static int totalPages(long totalCount, int pageSize) {
        return pageSize > 0 ? (int) ((totalCount + pageSize - 1) / pageSize) : 0;
    }
}
