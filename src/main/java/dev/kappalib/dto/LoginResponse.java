package dev.kappalib.dto;

import dev.kappalib.entity.CookieValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {
    private ProfilePublicResponse profile;
    private String secretToken;
    private Map<String, CookieValue> cookies;
}
