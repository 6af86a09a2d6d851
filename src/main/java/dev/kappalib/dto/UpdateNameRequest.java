package dev.kappalib.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateNameRequest {

    @NotNull(message = "error.display_name_required")
    @Size(max = 200, message = "error.display_name_too_long")
    private String displayName;
}
