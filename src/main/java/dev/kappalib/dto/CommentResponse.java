package dev.kappalib.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommentResponse {
    private String id;
    private String chapterId;
    private String userId;
    private String contentHtml;
    private String status;
    private Long telegramMessageId;
    private OffsetDateTime createdAt;
    private String userDisplayName;
    private String userAvatarSeed;
    private Boolean userHasCustomAvatar;
}
