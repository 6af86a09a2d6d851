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
public class CommentsPage {
    private List<CommentResponse> comments;
    private int page;
    private int pageSize;
    private long totalCount;
    private int totalPages;

    public static CommentsPage of(List<CommentResponse> comments, int page, int pageSize, long totalCount) {
        return CommentsPage.builder()
                .comments(comments)
                .page(page)
                .pageSize(pageSize)
                .totalCount(totalCount)
                .totalPages(NovelsPage.totalPages(totalCount, pageSize))
                .build();
    }

    public static CommentsPage empty(int page, int pageSize) {
        return of(List.of(), page, pageSize, 0);
    }
}
