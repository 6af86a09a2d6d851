package dev.kappalib.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Server-side mirror of a profile's preference cookies.
 * Stored in PostgreSQL as JSONB: {"kappalib_theme": {"value": "dark", "updated_at": 1718000000000}}
 */
@Slf4j
public class CookieBag {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<Map<String, CookieValue>> MAP_TYPE_REF = new TypeReference<>(){};

    private static final Pattern NAME_PATTERN = Pattern.compile("^kappalib_[a-z0-9_]{1,50}$");
    private static final Pattern VALUE_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-]{1,200}$");

    private final Map<String, CookieValue> entries;

    public CookieBag() {
        this.entries = new LinkedHashMap<>();
    }

    @JsonCreator
    public CookieBag(Map<String, CookieValue> entries) {
        this.entries = entries != null ? new LinkedHashMap<>(entries) : new LinkedHashMap<>();
    }

    public static CookieBag empty() {
        return new CookieBag();
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    public static boolean isValidValue(String value) {
        return value != null && VALUE_PATTERN.matcher(value).matches();
    }

    /**
     * Copy of this bag without the entries whose name or value fails the format rules.
     */
    public CookieBag validated() {
        Map<String, CookieValue> valid = new LinkedHashMap<>();
        entries.forEach((name, cookie) -> {
            if (isValidName(name) && cookie != null && isValidValue(cookie.getValue())) {
                valid.put(name, cookie);
            } else {
                log.debug("Dropping invalid cookie entry '{}'", name);
            }
        });
        return new CookieBag(valid);
    }

    /**
     * Last-write-wins merge keyed on the client timestamp. An incoming entry replaces an
     * existing one only when its {@code updatedAt} is strictly greater.
     */
    public CookieBag mergedWith(CookieBag incoming) {
        Map<String, CookieValue> result = new LinkedHashMap<>(entries);
        incoming.entries.forEach((name, incomingValue) -> {
            CookieValue existing = result.get(name);
            if (existing == null || incomingValue.getUpdatedAt() > existing.getUpdatedAt()) {
                result.put(name, incomingValue);
            }
        });
        return new CookieBag(result);
    }

    public CookieValue get(String name) {
        return entries.get(name);
    }

    @JsonValue
    public Map<String, CookieValue> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize CookieBag", e);
        }
    }

    public static CookieBag fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new CookieBag();
        }
        try {
            return new CookieBag(MAPPER.readValue(json, MAP_TYPE_REF));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cookie bag, treating as empty: {}", e.getOriginalMessage());
            return new CookieBag();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CookieBag)) return false;
        return Objects.equals(entries, ((CookieBag) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "CookieBag" + entries.keySet();
    }
}
