package dev.kappalib.config;

import dev.kappalib.util.IpAddressExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.WebFilter;

import java.time.Duration;
import java.time.Instant;

/**
 * One access log line per request, prefixed with the id assigned by {@link RequestIdFilter}.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            Instant start = Instant.now();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();
            String clientIp = IpAddressExtractor.extractClientIp(exchange);
            String rawRequestId = exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
            String requestId = rawRequestId == null ? "-" : rawRequestId;

            return chain.filter(exchange)
                    .doOnSuccess(done -> {
                        HttpStatusCode status = exchange.getResponse().getStatusCode();
                        int code = status != null ? status.value() : 200;
                        logRequest(requestId, method, path, clientIp, code, Duration.between(start, Instant.now()));
                    })
                    .doOnError(error -> log.error("[{}] {} {} from {} - ERROR {} in {}ms",
                            requestId, method, path, clientIp, error.getMessage(),
                            Duration.between(start, Instant.now()).toMillis()));
        };
    }

    private void logRequest(String requestId, String method, String path, String clientIp, int status, Duration duration) {
        if (path.startsWith("/actuator") || path.startsWith("/swagger") || path.startsWith("/v3/api-docs")) {
            log.trace("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        } else if (status >= 400) {
            log.warn("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        } else {
            log.info("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        }
    }
}
