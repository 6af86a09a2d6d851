package dev.kappalib.config;

import dev.kappalib.config.converter.CookieBagToJsonConverter;
import dev.kappalib.config.converter.JsonToCookieBagConverter;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

import java.util.List;

@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.kappalib.repository")
@Slf4j
public class R2dbcConfig {

    @Value("${app.schema.file:schema.sql}")
    private String schemaFile;

    /**
     * Applies {@code schema.sql} on startup when {@code app.schema.init=true}.
     * The populator splits on {@code ;}, so function bodies in the schema are
     * written as single-quoted strings rather than dollar-quoted blocks.
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true", matchIfMissing = false)
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        log.info("Schema initialisation enabled ({})", schemaFile);
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(schemaFile)));
        return initializer;
    }

    @Bean
    public R2dbcCustomConversions r2dbcCustomConversions(ConnectionFactory connectionFactory) {
        var dialect = DialectResolver.getDialect(connectionFactory);
        return R2dbcCustomConversions.of(dialect, List.of(
                new JsonToCookieBagConverter(),
                new CookieBagToJsonConverter()
        ));
    }
}
