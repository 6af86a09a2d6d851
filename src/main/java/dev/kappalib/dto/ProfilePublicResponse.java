package dev.kappalib.dto;

import dev.kappalib.entity.Profile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfilePublicResponse {
    private String id;
    private String displayName;
    private String avatarSeed;
    private boolean hasCustomAvatar;
    private OffsetDateTime createdAt;

    public static ProfilePublicResponse from(Profile profile) {
        return ProfilePublicResponse.builder()
                .id(profile.getId())
                .displayName(profile.getDisplayName())
                .avatarSeed(profile.getAvatarSeed())
                .hasCustomAvatar(profile.isHasCustomAvatar())
                .createdAt(profile.getCreatedAt())
                .build();
    }
}
