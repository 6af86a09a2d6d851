package dev.kappalib.dto;

import dev.kappalib.entity.CookieValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncCookiesRequest {
    private Map<String, CookieValue> cookies;
}
