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

/**
 * Pseudonymous reader profile. The secret token is the only credential.
 */
@Table("users")
@Getter
@Setter
@ToString(exclude = {"secretToken", "syncCode"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Profile implements Persistable<String>, NewRecordAware {

    @Id
    private String id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("secret_token")
    private String secretToken;

    @Column("display_name")
    private String displayName;

    @Column("avatar_seed")
    private String avatarSeed;

    @Column("has_custom_avatar")
    private boolean hasCustomAvatar;

    @Builder.Default
    private CookieBag cookies = CookieBag.empty();

    @Column("sync_code")
    private String syncCode;

    @Column("sync_code_expires_at")
    private OffsetDateTime syncCodeExpiresAt;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("last_active_at")
    private OffsetDateTime lastActiveAt;
}
