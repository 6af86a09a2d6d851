package dev.kappalib.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

@Table("comments")
@Getter
@Setter
@ToString(exclude = "contentHtml")
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment implements Persistable<String>, NewRecordAware {

    @Id
    private String id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("chapter_id")
    private String chapterId;

    @Column("user_id")
    private String userId;

    @Column("content_html")
    private String contentHtml;

    @Builder.Default
    private String status = "pending"; // pending, approved, rejected

    @Column("telegram_message_id")
    private Long telegramMessageId;

    @Column("created_at")
    private OffsetDateTime createdAt;
}
