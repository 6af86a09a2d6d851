package dev.kappalib.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One mirrored client cookie. {@code updatedAt} is the client's epoch-millisecond
 * clock and is the only input to conflict resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CookieValue {
    private String value;
    private long updatedAt;
}
