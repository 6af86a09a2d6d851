package dev.kappalib.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvatarUploadRequest {

    /** Base64 encoded JPEG or PNG, optionally prefixed with a data URL header. */
    @NotBlank(message = "error.image_required")
    private String image;
}
