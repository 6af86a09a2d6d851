package dev.kappalib.repository;

import dev.kappalib.entity.Profile;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

@Repository
public interface ProfileRepository extends ReactiveCrudRepository<Profile, String> {

    @Query("SELECT secret_token FROM users WHERE id = :id")
    Mono<String> findSecretTokenById(String id);

    /**
     * Clears an unexpired sync code and returns its profile in one statement, so a code
     * can be redeemed by at most one caller. Empty when the code is unknown, expired or
     * already used.
     */
    @Query("UPDATE users SET sync_code = NULL, sync_code_expires_at = NULL, last_active_at = now() "
            + "WHERE sync_code = :syncCode AND sync_code_expires_at > now() RETURNING *")
    Mono<Profile> consumeSyncCode(String syncCode);

    @Modifying
    @Query("UPDATE users SET last_active_at = now() WHERE id = :id")
    Mono<Integer> touchLastActive(String id);

    @Modifying
    @Query("UPDATE users SET sync_code = :syncCode, sync_code_expires_at = :expiresAt, last_active_at = now() WHERE id = :id")
    Mono<Integer> updateSyncCode(String id, String syncCode, OffsetDateTime expiresAt);

    @Modifying
    @Query("UPDATE users SET display_name = :displayName, last_active_at = now() WHERE id = :id")
    Mono<Integer> updateDisplayName(String id, String displayName);

    @Modifying
    @Query("UPDATE users SET has_custom_avatar = true, last_active_at = now() WHERE id = :id")
    Mono<Integer> markCustomAvatar(String id);

    @Modifying
    @Query("DELETE FROM users WHERE id = :id")
    Mono<Integer> deleteProfile(String id);
}
