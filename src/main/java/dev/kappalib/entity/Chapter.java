package dev.kappalib.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

@Table("chapters")
@Getter
@Setter
@ToString(exclude = "content")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chapter {

    @Id
    private String id;

    @Column("novel_id")
    private String novelId;

    @Column("chapter_num")
    private Integer chapterNum;

    private String title;

    @Column("title_en")
    private String titleEn;

    private String content;

    @Column("source_id")
    private Integer sourceId;

    @Column("created_at")
    private OffsetDateTime createdAt;
}
