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

/**
 * Catalog entry. Read-only for this service; the normalized search columns
 * are generated by the database and not mapped here.
 */
@Table("novels")
@Getter
@Setter
@ToString(of = {"id", "title"})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Novel {

    @Id
    private String id;

    private String title;

    @Column("title_en")
    private String titleEn;

    private String author;

    @Column("year_start")
    private Integer yearStart;

    @Column("year_end")
    private Integer yearEnd;

    private String status; // ongoing, completed, announced

    private String description;

    @Column("age_rating")
    private String ageRating;

    @Column("cover_url")
    private String coverUrl;

    @Column("chapters_count")
    private Integer chaptersCount;

    @Column("created_at")
    private OffsetDateTime createdAt;
}
