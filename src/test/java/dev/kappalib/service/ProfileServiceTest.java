package dev.kappalib.service;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.entity.CookieBag;
import dev.kappalib.entity.CookieValue;
import dev.kappalib.entity.Profile;
import dev.kappalib.exception.DuplicateResourceException;
import dev.kappalib.exception.ForbiddenException;
import dev.kappalib.exception.ResourceNotFoundException;
import dev.kappalib.exception.UpstreamServiceException;
import dev.kappalib.metrics.KappalibMetrics;
import dev.kappalib.repository.ProfileRepository;
import dev.kappalib.service.storage.StorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.r2dbc.repository.Query;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

    private static final String PROFILE_ID = "usr_ab12cd34";
    private static final String TOKEN = "a".repeat(64);

    @Mock
    private ProfileRepository profileRepository;

    @Mock
    private SecretGenerator secretGenerator;

    @Mock
    private TurnstileService turnstileService;

    @Mock
    private AvatarImageProcessor avatarImageProcessor;

    @Mock
    private StorageProvider storageProvider;

    @Mock
    private KappalibMetrics metrics;

    private MutableClock clock;
    private ProfileService profileService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        profileService = new ProfileService(profileRepository, secretGenerator, turnstileService,
                new HtmlSanitizerService(), avatarImageProcessor, storageProvider,
                new ResilienceConfig(10, 10, 30, 30, 3, 10), metrics, clock, 5 * 1024 * 1024);
    }

    private static Profile profile() {
        return Profile.builder()
                .id(PROFILE_ID)
                .secretToken(TOKEN)
                .displayName("Тихий Ёж")
                .avatarSeed("0123456789abcdef")
                .cookies(CookieBag.empty())
                .createdAt(OffsetDateTime.parse("2025-01-01T00:00:00Z"))
                .newRecord(false)
                .build();
    }

    private void givenValidToken() {
        when(profileRepository.findSecretTokenById(PROFILE_ID)).thenReturn(Mono.just(TOKEN));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @BeforeEach
        void stubGenerator() {
            when(turnstileService.verify("captcha", TurnstileService.Scope.PROFILE)).thenReturn(Mono.empty());
            when(secretGenerator.newId(SecretGenerator.PROFILE_ID_PREFIX)).thenReturn(PROFILE_ID);
            when(secretGenerator.newSecretToken()).thenReturn(TOKEN);
            when(secretGenerator.newDisplayName()).thenReturn("Тихий Ёж");
            when(secretGenerator.newAvatarSeed()).thenReturn("0123456789abcdef");
        }

        @Test
        @DisplayName("Should return the new profile with its secret token")
        void shouldCreateProfile() {
            when(profileRepository.save(any(Profile.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(profileService.create("captcha"))
                    .assertNext(created -> {
                        assertThat(created.getId()).isEqualTo(PROFILE_ID);
                        assertThat(created.getSecretToken()).isEqualTo(TOKEN);
                        assertThat(created.getDisplayName()).isEqualTo("Тихий Ёж");
                    })
                    .verifyComplete();
            verify(metrics).incrementProfileCreated();
        }

        @Test
        @DisplayName("Should regenerate the id after a key collision")
        void shouldRetryOnCollision() {
            when(profileRepository.save(any(Profile.class)))
                    .thenReturn(Mono.error(new DuplicateKeyException("users_pkey")))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(profileService.create("captcha"))
                    .expectNextCount(1)
                    .verifyComplete();
            verify(profileRepository, times(2)).save(any(Profile.class));
        }

        @Test
        @DisplayName("Should give up with a conflict after five collisions")
        void shouldFailAfterFiveCollisions() {
            when(profileRepository.save(any(Profile.class)))
                    .thenReturn(Mono.error(new DuplicateKeyException("users_pkey")));

            StepVerifier.create(profileService.create("captcha"))
                    .expectError(DuplicateResourceException.class)
                    .verify();
            verify(profileRepository, times(5)).save(any(Profile.class));
        }
    }

    @Test
    @DisplayName("Failed captcha should not create a profile")
    void failedCaptchaShouldNotCreate() {
        when(turnstileService.verify("bad", TurnstileService.Scope.PROFILE))
                .thenReturn(Mono.error(new TurnstileService.TurnstileException("error.captcha_failed")));

        StepVerifier.create(profileService.create("bad"))
                .expectError(TurnstileService.TurnstileException.class)
                .verify();
        verify(profileRepository, never()).save(any(Profile.class));
    }

    @Nested
    @DisplayName("authenticate")
    class Authenticate {

        @Test
        @DisplayName("Wrong token should be forbidden")
        void wrongTokenIsForbidden() {
            givenValidToken();

            StepVerifier.create(profileService.authenticate(PROFILE_ID, "b".repeat(64)))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("Unknown profile should look like a wrong token")
        void unknownProfileIsForbidden() {
            when(profileRepository.findSecretTokenById("usr_missing")).thenReturn(Mono.empty());

            StepVerifier.create(profileService.authenticate("usr_missing", TOKEN))
                    .expectError(ForbiddenException.class)
                    .verify();
        }

        @Test
        @DisplayName("Missing token should be forbidden without a lookup")
        void missingTokenIsForbidden() {
            StepVerifier.create(profileService.authenticate(PROFILE_ID, null))
                    .expectError(ForbiddenException.class)
                    .verify();
            verify(profileRepository, never()).findSecretTokenById(anyString());
        }
    }

    @Nested
    @DisplayName("Sync codes")
    class SyncCodes {

        @Test
        @DisplayName("Should store the code with a 15 minute expiry")
        void shouldGenerateCode() {
            givenValidToken();
            when(secretGenerator.newSyncCode()).thenReturn("ABCD2345");
            when(profileRepository.updateSyncCode(eq(PROFILE_ID), eq("ABCD2345"), any(OffsetDateTime.class)))
                    .thenReturn(Mono.just(1));

            StepVerifier.create(profileService.generateSyncCode(PROFILE_ID, TOKEN))
                    .assertNext(response -> {
                        assertThat(response.syncCode()).isEqualTo("ABCD2345");
                        assertThat(response.expiresAt()).startsWith("2025-03-01T10:15");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Login should normalize the code and consume it")
        void loginConsumesCode() {
            Profile stored = profile();
            stored.setCookies(new CookieBag(Map.of("kappalib_theme", new CookieValue("dark", 10L))));
            when(profileRepository.consumeSyncCode("ABCD2345")).thenReturn(Mono.just(stored));

            StepVerifier.create(profileService.loginWithCode(" abcd2345 "))
                    .assertNext(login -> {
                        assertThat(login.getSecretToken()).isEqualTo(TOKEN);
                        assertThat(login.getProfile().getId()).isEqualTo(PROFILE_ID);
                        assertThat(login.getCookies()).containsKey("kappalib_theme");
                    })
                    .verifyComplete();
            verify(profileRepository).consumeSyncCode("ABCD2345");
        }

        @Test
        @DisplayName("Second login with the same code should fail")
        void codeIsSingleUse() {
            when(profileRepository.consumeSyncCode("ABCD2345"))
                    .thenReturn(Mono.just(profile()))
                    .thenReturn(Mono.empty());

            StepVerifier.create(profileService.loginWithCode("ABCD2345")).expectNextCount(1).verifyComplete();
            StepVerifier.create(profileService.loginWithCode("ABCD2345"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Code of the wrong length should fail without a lookup")
        void malformedCodeFails() {
            StepVerifier.create(profileService.loginWithCode("ABC"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
            verify(profileRepository, never()).consumeSyncCode(anyString());
        }

        @Test
        @DisplayName("Code lookup and invalidation should be a single guarded statement")
        void codeIsConsumedAtomically() throws NoSuchMethodException {
            Query query = ProfileRepository.class.getMethod("consumeSyncCode", String.class)
                    .getAnnotation(Query.class);

            assertThat(query.value())
                    .startsWith("UPDATE users SET sync_code = NULL")
                    .contains("WHERE sync_code = :syncCode AND sync_code_expires_at > now()")
                    .endsWith("RETURNING *");
        }
    }

    @Test
    @DisplayName("syncCookies should keep the newer value per cookie and drop invalid entries")
    void syncCookiesMerges() {
        Profile stored = profile();
        stored.setCookies(new CookieBag(Map.of(
                "kappalib_theme", new CookieValue("dark", 200L),
                "kappalib_font", new CookieValue("serif", 100L))));
        givenValidToken();
        when(profileRepository.findById(PROFILE_ID)).thenReturn(Mono.just(stored));
        when(profileRepository.save(any(Profile.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        Map<String, CookieValue> incoming = new HashMap<>();
        incoming.put("kappalib_theme", new CookieValue("light", 150L));
        incoming.put("kappalib_font", new CookieValue("sans", 300L));
        incoming.put("session", new CookieValue("x", 999L));

        StepVerifier.create(profileService.syncCookies(PROFILE_ID, TOKEN, incoming))
                .assertNext(merged -> {
                    assertThat(merged).containsOnlyKeys("kappalib_theme", "kappalib_font");
                    assertThat(merged.get("kappalib_theme").getValue()).isEqualTo("dark");
                    assertThat(merged.get("kappalib_font").getValue()).isEqualTo("sans");
                })
                .verifyComplete();

        ArgumentCaptor<Profile> saved = ArgumentCaptor.forClass(Profile.class);
        verify(profileRepository).save(saved.capture());
        assertThat(saved.getValue().isNew()).isFalse();
    }

    @Nested
    @DisplayName("Display names")
    class DisplayNames {

        @Test
        @DisplayName("Should strip markup and collapse whitespace")
        void shouldNormalize() {
            assertThat(profileService.normalizeDisplayName("  <b>Тихий</b>   Ёж ")).isEqualTo("Тихий Ёж");
        }

        @Test
        @DisplayName("Should reject empty, long and punctuated names")
        void shouldReject() {
            assertThatThrownBy(() -> profileService.normalizeDisplayName("<i></i>"))
                    .hasMessage("error.display_name_empty");
            assertThatThrownBy(() -> profileService.normalizeDisplayName("Оченьдлинноеимяч"))
                    .hasMessage("error.display_name_too_long");
            assertThatThrownBy(() -> profileService.normalizeDisplayName("Ёж!"))
                    .hasMessage("error.display_name_invalid");
        }

        @Test
        @DisplayName("Fifteen letters should be the longest accepted name")
        void fifteenLettersIsAccepted() {
            String name = "Оченьдлинноеимя";
            assertThat(name.codePointCount(0, name.length())).isEqualTo(15);

            assertThat(profileService.normalizeDisplayName(name)).isEqualTo(name);
        }

        @Test
        @DisplayName("Rejected name should not reach the database")
        void rejectedNameIsNotStored() {
            givenValidToken();

            StepVerifier.create(profileService.updateDisplayName(PROFILE_ID, TOKEN, "a;b"))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            verify(profileRepository, never()).updateDisplayName(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Avatars")
    class Avatars {

        @Test
        @DisplayName("Should store the processed JPEG and flag the profile")
        void shouldStoreAvatar() {
            byte[] upload = {1, 2, 3};
            byte[] jpeg = {(byte) 0xFF, (byte) 0xD8};
            givenValidToken();
            when(avatarImageProcessor.process(upload)).thenReturn(jpeg);
            when(storageProvider.store("avatars/" + PROFILE_ID + ".jpg", jpeg, "image/jpeg", "public, max-age=3600"))
                    .thenReturn(Mono.just("/uploads/avatars/" + PROFILE_ID + ".jpg"));
            when(profileRepository.markCustomAvatar(PROFILE_ID)).thenReturn(Mono.just(1));
            Profile updated = profile();
            updated.setHasCustomAvatar(true);
            when(profileRepository.findById(PROFILE_ID)).thenReturn(Mono.just(updated));
            when(profileRepository.touchLastActive(PROFILE_ID)).thenReturn(Mono.just(1));

            String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(upload);
            StepVerifier.create(profileService.updateAvatar(PROFILE_ID, TOKEN, dataUrl))
                    .assertNext(response -> assertThat(response.isHasCustomAvatar()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Storage failure should surface as an upstream error")
        void storageFailureIsUpstream() {
            byte[] upload = {1, 2, 3};
            givenValidToken();
            when(avatarImageProcessor.process(upload)).thenReturn(new byte[]{9});
            when(storageProvider.store(anyString(), any(), anyString(), anyString()))
                    .thenReturn(Mono.error(new IllegalStateException("bucket gone")));

            StepVerifier.create(profileService.updateAvatar(PROFILE_ID, TOKEN,
                            Base64.getEncoder().encodeToString(upload)))
                    .expectError(UpstreamServiceException.class)
                    .verify();
            verify(profileRepository, never()).markCustomAvatar(anyString());
        }

        @Test
        @DisplayName("Oversized upload should be rejected before decoding the image")
        void oversizedUploadIsRejected() {
            ProfileService small = new ProfileService(profileRepository, secretGenerator, turnstileService,
                    new HtmlSanitizerService(), avatarImageProcessor, storageProvider,
                    new ResilienceConfig(10, 10, 30, 30, 3, 10), metrics, clock, 4);
            givenValidToken();

            StepVerifier.create(small.updateAvatar(PROFILE_ID, TOKEN,
                            Base64.getEncoder().encodeToString(new byte[]{1, 2, 3, 4, 5})))
                    .expectErrorMessage("error.image_too_large")
                    .verify();
        }

        @Test
        @DisplayName("Caller cancelled while waiting for a slot should neither process nor keep a slot")
        void cancelledWaiterSkipsProcessing() throws InterruptedException {
            givenValidToken();
            int permits = profileService.avatarPermits.drainPermits();

            Disposable upload = profileService.updateAvatar(PROFILE_ID, TOKEN,
                    Base64.getEncoder().encodeToString(new byte[]{1, 2, 3})).subscribe();
            Thread.sleep(300);
            upload.dispose();
            profileService.avatarPermits.release(permits);

            verify(avatarImageProcessor, after(500).never()).process(any());
            assertThat(profileService.avatarPermits.availablePermits()).isEqualTo(permits);
        }

        @Test
        @DisplayName("No free slot within the storage timeout should be rate limited")
        void busySlotsAreRateLimited() {
            ProfileService impatient = new ProfileService(profileRepository, secretGenerator, turnstileService,
                    new HtmlSanitizerService(), avatarImageProcessor, storageProvider,
                    new ResilienceConfig(10, 10, 1, 30, 3, 10), metrics, clock, 5 * 1024 * 1024);
            givenValidToken();
            impatient.avatarPermits.drainPermits();

            StepVerifier.create(impatient.updateAvatar(PROFILE_ID, TOKEN,
                            Base64.getEncoder().encodeToString(new byte[]{1, 2, 3})))
                    .expectErrorMessage("error.avatar_busy")
                    .verify(Duration.ofSeconds(5));
            verify(avatarImageProcessor, never()).process(any());
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("Should delete and count the profile")
        void shouldDelete() {
            givenValidToken();
            when(profileRepository.deleteProfile(PROFILE_ID)).thenReturn(Mono.just(1));

            StepVerifier.create(profileService.delete(PROFILE_ID, TOKEN)).verifyComplete();
            verify(metrics).incrementProfileDeleted();
        }

        @Test
        @DisplayName("Row already gone should be not found")
        void goneRowIsNotFound() {
            givenValidToken();
            when(profileRepository.deleteProfile(PROFILE_ID)).thenReturn(Mono.just(0));

            StepVerifier.create(profileService.delete(PROFILE_ID, TOKEN))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }
}
