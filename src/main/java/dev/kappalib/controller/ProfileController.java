package dev.kappalib.controller;

import dev.kappalib.dto.AvatarUploadRequest;
import dev.kappalib.dto.CreateProfileRequest;
import dev.kappalib.dto.LoginRequest;
import dev.kappalib.dto.LoginResponse;
import dev.kappalib.dto.ProfilePublicResponse;
import dev.kappalib.dto.ProfileWithTokenResponse;
import dev.kappalib.dto.SyncCodeResponse;
import dev.kappalib.dto.SyncCookiesRequest;
import dev.kappalib.dto.UpdateNameRequest;
import dev.kappalib.entity.CookieValue;
import dev.kappalib.service.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Pseudonymous profiles. Mutating calls authenticate with the {@code X-Secret-Token} header;
 * a missing header is treated the same as a wrong one.
 */
@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
@Validated
@Tag(name = "Profile", description = "Pseudonymous profiles and cross-device sync")
@Slf4j
public class ProfileController {

    static final String PROFILE_ID_HEADER = "X-Profile-ID";
    static final String SECRET_TOKEN_HEADER = "X-Secret-Token";

    private final ProfileService profileService;

    @PostMapping
    @Operation(summary = "Create profile", description = "Creates an anonymous profile after a captcha check")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile created, secret token returned once"),
            @ApiResponse(responseCode = "400", description = "Captcha failed")
    })
    public Mono<ProfileWithTokenResponse> createProfile(@Valid @RequestBody CreateProfileRequest request) {
        return profileService.create(request.getTurnstileToken());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get public profile")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile found"),
            @ApiResponse(responseCode = "404", description = "Profile not found")
    })
    public Mono<ProfilePublicResponse> getProfile(
            @PathVariable @Size(max = 64) @Parameter(description = "Profile id") String id) {
        return profileService.get(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete profile")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Profile deleted"),
            @ApiResponse(responseCode = "403", description = "Invalid secret token"),
            @ApiResponse(responseCode = "404", description = "Profile not found")
    })
    public Mono<Void> deleteProfile(
            @PathVariable @Size(max = 64) String id,
            @RequestHeader(value = SECRET_TOKEN_HEADER, required = false) String secretToken) {
        log.info("Deleting profile {}", id);
        return profileService.delete(id, secretToken);
    }

    @PostMapping("/{id}/sync-code")
    @Operation(summary = "Generate sync code", description = "Single-use code valid for 15 minutes")
    public Mono<SyncCodeResponse> generateSyncCode(
            @PathVariable @Size(max = 64) String id,
            @RequestHeader(value = SECRET_TOKEN_HEADER, required = false) String secretToken) {
        return profileService.generateSyncCode(id, secretToken);
    }

    @PostMapping("/login")
    @Operation(summary = "Log in with sync code", description = "Consumes the code and returns the profile credentials")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code accepted"),
            @ApiResponse(responseCode = "404", description = "Unknown or expired code")
    })
    public Mono<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return profileService.loginWithCode(request.getSyncCode());
    }

    @PostMapping("/sync-cookies")
    @Operation(summary = "Merge preference cookies", description = "Last-write-wins merge on client timestamps")
    public Mono<Map<String, CookieValue>> syncCookies(
            @RequestHeader(value = PROFILE_ID_HEADER, required = false) String profileId,
            @RequestHeader(value = SECRET_TOKEN_HEADER, required = false) String secretToken,
            @RequestBody SyncCookiesRequest request) {
        return profileService.syncCookies(profileId, secretToken, request.getCookies());
    }

    @PatchMapping("/{id}/name")
    @Operation(summary = "Change display name")
    public Mono<ProfilePublicResponse> updateName(
            @PathVariable @Size(max = 64) String id,
            @RequestHeader(value = SECRET_TOKEN_HEADER, required = false) String secretToken,
            @Valid @RequestBody UpdateNameRequest request) {
        return profileService.updateDisplayName(id, secretToken, request.getDisplayName());
    }

    @PostMapping("/{id}/avatar")
    @Operation(summary = "Upload avatar", description = "JPEG or PNG as base64, cropped to 250x250")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Avatar stored"),
            @ApiResponse(responseCode = "400", description = "Unsupported or oversized image"),
            @ApiResponse(responseCode = "403", description = "Invalid secret token")
    })
    public Mono<ProfilePublicResponse> uploadAvatar(
            @PathVariable @Size(max = 64) String id,
            @RequestHeader(value = SECRET_TOKEN_HEADER, required = false) String secretToken,
            @Valid @RequestBody AvatarUploadRequest request) {
        return profileService.updateAvatar(id, secretToken, request.getImage());
    }
}
