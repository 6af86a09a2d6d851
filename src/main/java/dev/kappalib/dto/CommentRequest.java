package dev.kappalib.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comment submission. Content length is checked by the service so that the
 * order of rejections stays fixed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentRequest {

    /** Markdown source, 1..1000 characters. */
    private String content;

    private String turnstileToken;
}
