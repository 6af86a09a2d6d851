package dev.kappalib.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${app.site-url:https://kappalib.ru}")
    private String siteUrl;

    // Imperative bean so the server URL can come from configuration
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("kappalib API")
                        .description("""
                                Public API for accessing kappalib services.

                                ## Profiles
                                Profiles are anonymous. Creating one returns a secret token once;
                                mutating profile and comment calls send it as `X-Secret-Token`
                                (and the profile id as `X-Profile-ID` where the path has none).
                                """)
                        .version(appVersion)
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(new Server().url(siteUrl).description("Production Server")))
                .components(new Components()
                        .addSecuritySchemes("profileId", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Profile-ID"))
                        .addSecuritySchemes("secretToken", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Secret-Token")));
    }
}
