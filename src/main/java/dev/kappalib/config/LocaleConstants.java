package dev.kappalib.config;

import java.util.List;
import java.util.Locale;

/**
 * Locales the API answers in. Russian is the site language and the default.
 */
public final class LocaleConstants {

    private LocaleConstants() {}

    public static final Locale RUSSIAN = Locale.forLanguageTag("ru");

    public static final Locale DEFAULT_LOCALE = RUSSIAN;

    public static final List<Locale> SUPPORTED_LOCALES = List.of(
            RUSSIAN,
            Locale.ENGLISH
    );
}
