package dev.kappalib.config.converter;

import dev.kappalib.entity.CookieBag;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * R2DBC Reading converter: PostgreSQL JSONB (Json) → CookieBag.
 */
@ReadingConverter
public class JsonToCookieBagConverter implements Converter<Json, CookieBag> {

    @Override
    public CookieBag convert(Json source) {
        return CookieBag.fromJson(source.asString());
    }
}
