package dev.kappalib.dto;

import dev.kappalib.entity.Profile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Returned once, on creation. The secret token is never shown again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileWithTokenResponse {
    private String id;
    private String secretToken;
    private String displayName;
    private String avatarSeed;
    private OffsetDateTime createdAt;

    public static ProfileWithTokenResponse from(Profile profile) {
        return ProfileWithTokenResponse.builder()
                .id(profile.getId())
                .secretToken(profile.getSecretToken())
                .displayName(profile.getDisplayName())
                .avatarSeed(profile.getAvatarSeed())
                .createdAt(profile.getCreatedAt())
                .build();
    }
}
