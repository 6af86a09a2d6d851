package dev.kappalib.config.converter;

import dev.kappalib.entity.CookieBag;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * R2DBC Writing converter: CookieBag → PostgreSQL JSONB (Json).
 */
@WritingConverter
public class CookieBagToJsonConverter implements Converter<CookieBag, Json> {

    @Override
    public Json convert(CookieBag source) {
        return Json.of(source.toJson());
    }
}
