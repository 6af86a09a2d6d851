package dev.kappalib.service;

import dev.kappalib.config.ResilienceConfig;
import dev.kappalib.dto.LoginResponse;
import dev.kappalib.dto.ProfilePublicResponse;
import dev.kappalib.dto.ProfileWithTokenResponse;
import dev.kappalib.dto.SyncCodeResponse;
import dev.kappalib.entity.CookieBag;
import dev.kappalib.entity.CookieValue;
import dev.kappalib.entity.Profile;
import dev.kappalib.exception.DuplicateResourceException;
import dev.kappalib.exception.ForbiddenException;
import dev.kappalib.exception.RateLimitedException;
import dev.kappalib.exception.ResourceNotFoundException;
import dev.kappalib.exception.UnsupportedImageException;
import dev.kappalib.exception.UpstreamServiceException;
import dev.kappalib.metrics.KappalibMetrics;
import dev.kappalib.repository.ProfileRepository;
import dev.kappalib.service.storage.StorageProvider;
import dev.kappalib.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Pseudonymous reader profiles. A profile is created anonymously behind a captcha and
 * every later change is authorised by its secret token.
 */
@Service
@Slf4j
public class ProfileService {

    static final Duration SYNC_CODE_TTL = Duration.ofMinutes(15);
    static final int MAX_INSERT_ATTEMPTS = 5;
    static final int MAX_DISPLAY_NAME_LENGTH = 15;
    static final int MAX_CONCURRENT_AVATAR_JOBS = 5;
    static final String AVATAR_CACHE_CONTROL = "public, max-age=3600";
    static final Duration AVATAR_PERMIT_POLL = Duration.ofMillis(100);

    private static final Pattern DISPLAY_NAME_PATTERN = Pattern.compile("^[\\p{L}\\p{N} ]+$");
    private static final Pattern DATA_URL_PREFIX = Pattern.compile("^data:[^,]*;base64,");

    private final ProfileRepository profileRepository;
    private final SecretGenerator secretGenerator;
    private final TurnstileService turnstileService;
    private final HtmlSanitizerService htmlSanitizerService;
    private final AvatarImageProcessor avatarImageProcessor;
    private final StorageProvider storageProvider;
    private final ResilienceConfig resilience;
    private final KappalibMetrics metrics;
    private final Clock clock;
    private final int maxAvatarBytes;
    final Semaphore avatarPermits = new Semaphore(MAX_CONCURRENT_AVATAR_JOBS);

    public ProfileService(ProfileRepository profileRepository,
                          SecretGenerator secretGenerator,
                          TurnstileService turnstileService,
                          HtmlSanitizerService htmlSanitizerService,
                          AvatarImageProcessor avatarImageProcessor,
                          StorageProvider storageProvider,
                          ResilienceConfig resilience,
                          KappalibMetrics metrics,
                          Clock clock,
                          @Value("${app.avatar.max-bytes:5242880}") int maxAvatarBytes) {
        this.profileRepository = profileRepository;
        this.secretGenerator = secretGenerator;
        this.turnstileService = turnstileService;
        this.htmlSanitizerService = htmlSanitizerService;
        this.avatarImageProcessor = avatarImageProcessor;
        this.storageProvider = storageProvider;
        this.resilience = resilience;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAvatarBytes = maxAvatarBytes;
    }

    // ==================== CREATION AND LOOKUP ====================

    public Mono<ProfileWithTokenResponse> create(String captchaToken) {
        return turnstileService.verify(captchaToken, TurnstileService.Scope.PROFILE)
                .then(Mono.defer(this::insertNewProfile)
                        .retryWhen(duplicateKeyRetry())
                        .onErrorMap(Exceptions::isRetryExhausted,
                                ex -> new DuplicateResourceException("Could not allocate a unique profile id")))
                .doOnNext(profile -> {
                    metrics.incrementProfileCreated();
                    log.info("Profile created: {}", profile.getId());
                })
                .map(ProfileWithTokenResponse::from);
    }

    private Mono<Profile> insertNewProfile() {
        OffsetDateTime now = now();
        Profile profile = Profile.builder()
                .id(secretGenerator.newId(SecretGenerator.PROFILE_ID_PREFIX))
                .secretToken(secretGenerator.newSecretToken())
                .displayName(secretGenerator.newDisplayName())
                .avatarSeed(secretGenerator.newAvatarSeed())
                .cookies(CookieBag.empty())
                .createdAt(now)
                .lastActiveAt(now)
                .build();
        return profileRepository.save(profile)
                .timeout(resilience.getDatabaseTimeout());
    }

    /**
     * Public view of a profile. Reading counts as activity.
     */
    public Mono<ProfilePublicResponse> get(String profileId) {
        return profileRepository.findById(profileId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Profile", "id", profileId)))
                .flatMap(profile -> profileRepository.touchLastActive(profileId)
                        .onErrorResume(ex -> {
                            log.warn("Failed to update activity for {}: {}", profileId, ex.getMessage());
                            return Mono.just(0);
                        })
                        .thenReturn(ProfilePublicResponse.from(profile)))
                .timeout(resilience.getDatabaseTimeout());
    }

    /**
     * Completes when the token belongs to the profile, errors with {@link ForbiddenException}
     * otherwise. An unknown profile is indistinguishable from a wrong token.
     */
    public Mono<Void> authenticate(String profileId, String secretToken) {
        if (profileId == null || profileId.isBlank() || secretToken == null || secretToken.isBlank()) {
            return Mono.error(new ForbiddenException("error.invalid_secret_token"));
        }
        return profileRepository.findSecretTokenById(profileId)
                .timeout(resilience.getDatabaseTimeout())
                .filter(stored -> DigestUtils.constantTimeEquals(stored, secretToken))
                .switchIfEmpty(Mono.error(new ForbiddenException("error.invalid_secret_token")))
                .then();
    }

    // ==================== DEVICE SYNC ====================

    /**
     * Issue a fresh single-use sync code valid for 15 minutes, replacing any previous code.
     */
    public Mono<SyncCodeResponse> generateSyncCode(String profileId, String secretToken) {
        OffsetDateTime expiresAt = now().plus(SYNC_CODE_TTL);
        return authenticate(profileId, secretToken)
                .then(Mono.defer(() -> {
                            String code = secretGenerator.newSyncCode();
                            return profileRepository.updateSyncCode(profileId, code, expiresAt)
                                    .timeout(resilience.getDatabaseTimeout())
                                    .thenReturn(code);
                        })
                        .retryWhen(duplicateKeyRetry())
                        .onErrorMap(Exceptions::isRetryExhausted,
                                ex -> new DuplicateResourceException("Could not allocate a unique sync code")))
                .map(code -> {
                    log.info("Sync code generated for {}", profileId);
                    return new SyncCodeResponse(code, expiresAt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
                });
    }

    /**
     * Exchange a sync code for the profile's credentials. The code is consumed.
     */
    public Mono<LoginResponse> loginWithCode(String rawCode) {
        String code = rawCode == null ? "" : rawCode.trim().toUpperCase(Locale.ROOT);
        if (code.length() != SecretGenerator.SYNC_CODE_LENGTH) {
            return Mono.error(new ResourceNotFoundException("error.invalid_sync_code"));
        }
        return profileRepository.consumeSyncCode(code)
                .timeout(resilience.getDatabaseTimeout())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.invalid_sync_code")))
                .map(profile -> {
                    log.info("Login via sync code: {}", profile.getId());
                    return LoginResponse.builder()
                            .profile(ProfilePublicResponse.from(profile))
                            .secretToken(profile.getSecretToken())
                            .cookies(cookiesOf(profile))
                            .build();
                });
    }

    /**
     * Merge client cookies into the stored bag. Invalid entries are dropped silently.
     *
     * @return the merged bag as stored
     */
    public Mono<Map<String, CookieValue>> syncCookies(String profileId, String secretToken,
                                                      Map<String, CookieValue> cookies) {
        CookieBag incoming = new CookieBag(cookies).validated();
        return authenticate(profileId, secretToken)
                .then(Mono.defer(() -> profileRepository.findById(profileId)))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Profile", "id", profileId)))
                .flatMap(profile -> {
                    CookieBag stored = profile.getCookies() != null ? profile.getCookies() : CookieBag.empty();
                    CookieBag merged = stored.mergedWith(incoming);
                    profile.setCookies(merged);
                    profile.setLastActiveAt(now());
                    profile.setNewRecord(false);
                    return profileRepository.save(profile);
                })
                .timeout(resilience.getDatabaseTimeout())
                .map(this::cookiesOf)
                .doOnNext(merged -> log.debug("Cookies synced for {} ({} entries)", profileId, merged.size()));
    }

    // ==================== PROFILE EDITS ====================

    public Mono<ProfilePublicResponse> updateDisplayName(String profileId, String secretToken, String name) {
        return authenticate(profileId, secretToken)
                .then(Mono.fromCallable(() -> normalizeDisplayName(name)))
                .flatMap(validName -> profileRepository.updateDisplayName(profileId, validName)
                        .timeout(resilience.getDatabaseTimeout())
                        .doOnNext(updated -> log.debug("Updated display name for {}", profileId)))
                .then(Mono.defer(() -> get(profileId)));
    }

    /**
     * Strip markup, collapse whitespace and check the result: 1..15 code points,
     * letters, digits and spaces only.
     *
     * @throws IllegalArgumentException with an i18n key when the name is rejected
     */
    public String normalizeDisplayName(String name) {
        String normalized = htmlSanitizerService.stripHtml(name);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("error.display_name_empty");
        }
        if (normalized.codePointCount(0, normalized.length()) > MAX_DISPLAY_NAME_LENGTH) {
            throw new IllegalArgumentException("error.display_name_too_long");
        }
        if (!DISPLAY_NAME_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("error.display_name_invalid");
        }
        return normalized;
    }

    /**
     * Replace the profile's avatar with a processed copy of the uploaded image.
     *
     * @param base64Image JPEG or PNG bytes, base64 encoded, optionally as a data URL
     */
    public Mono<ProfilePublicResponse> updateAvatar(String profileId, String secretToken, String base64Image) {
        String key = "avatars/" + profileId + ".jpg";
        return authenticate(profileId, secretToken)
                .then(Mono.fromCallable(() -> decodeBase64(base64Image)))
                .flatMap(this::processWithPermit)
                .flatMap(jpeg -> storageProvider.store(key, jpeg, "image/jpeg", AVATAR_CACHE_CONTROL)
                        .timeout(resilience.getStorageTimeout())
                        .onErrorMap(ex -> new UpstreamServiceException("storage", "Avatar upload failed: " + ex.getMessage(), ex)))
                .flatMap(url -> profileRepository.markCustomAvatar(profileId)
                        .timeout(resilience.getDatabaseTimeout()))
                .doOnNext(updated -> log.info("Avatar updated for {}", profileId))
                .then(Mono.defer(() -> get(profileId)));
    }

    /**
     * Runs the image job once one of the shared slots is free. The wait polls so that a
     * cancelled caller gives up its place instead of taking a slot it no longer needs.
     */
    private Mono<byte[]> processWithPermit(byte[] image) {
        return Mono.defer(() -> {
            AtomicBoolean cancelled = new AtomicBoolean();
            return Mono.fromCallable(() -> {
                        if (!acquireAvatarPermit(cancelled)) {
                            return null;
                        }
                        try {
                            if (cancelled.get()) {
                                return null;
                            }
                            return avatarImageProcessor.process(image);
                        } finally {
                            avatarPermits.release();
                        }
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnCancel(() -> cancelled.set(true));
        });
    }

    private boolean acquireAvatarPermit(AtomicBoolean cancelled) throws InterruptedException {
        long deadline = System.nanoTime() + resilience.getStorageTimeout().toNanos();
        while (!cancelled.get()) {
            if (avatarPermits.tryAcquire(AVATAR_PERMIT_POLL.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            if (System.nanoTime() - deadline > 0) {
                log.warn("No free avatar processing slot within {}", resilience.getStorageTimeout());
                throw new RateLimitedException("error.avatar_busy", Duration.ofSeconds(1));
            }
        }
        log.debug("Avatar job cancelled while waiting for a slot");
        return false;
    }

    private byte[] decodeBase64(String base64Image) {
        if (base64Image == null || base64Image.isBlank()) {
            throw new IllegalArgumentException("error.image_required");
        }
        String payload = DATA_URL_PREFIX.matcher(base64Image.trim()).replaceFirst("");
        byte[] data;
        try {
            data = Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedImageException("Malformed base64 image", e);
        }
        if (data.length == 0) {
            throw new UnsupportedImageException("Empty image");
        }
        if (data.length > maxAvatarBytes) {
            throw new IllegalArgumentException("error.image_too_large");
        }
        return data;
    }

    // ==================== DELETION ====================

    /**
     * Delete the profile. Its comments go with it through the foreign key cascade.
     */
    public Mono<Void> delete(String profileId, String secretToken) {
        return authenticate(profileId, secretToken)
                .then(Mono.defer(() -> profileRepository.deleteProfile(profileId)))
                .timeout(resilience.getDatabaseTimeout())
                .flatMap(deleted -> {
                    if (deleted == 0) {
                        return Mono.<Void>error(new ResourceNotFoundException("Profile", "id", profileId));
                    }
                    metrics.incrementProfileDeleted();
                    log.info("Profile deleted: {}", profileId);
                    return Mono.<Void>empty();
                });
    }

    // ==================== HELPERS ====================

    private Map<String, CookieValue> cookiesOf(Profile profile) {
        return profile.getCookies() != null ? profile.getCookies().getEntries() : Map.of();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    private static Retry duplicateKeyRetry() {
        return Retry.max(MAX_INSERT_ATTEMPTS - 1)
                .filter(DuplicateKeyException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("Unique key collision, regenerating (attempt {})",
                        signal.totalRetries() + 2));
    }
}
