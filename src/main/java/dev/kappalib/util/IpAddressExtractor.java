package dev.kappalib.util;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the client address used as the per-IP rate limiting key.
 * <p>
 * Forwarding headers ({@code X-Forwarded-For}, {@code X-Real-IP}) are honoured only when the
 * direct peer is a trusted proxy, and the rightmost untrusted hop wins.
 * </p>
 */
public final class IpAddressExtractor {

    private static final Pattern IP_PATTERN = Pattern.compile("^[0-9a-fA-F.:]+$");

    /** Container bridge and K3s ranges the ingress runs in. */
    private static final String[] TRUSTED_PREFIXES = {
            "172.17.", "172.18.", "172.19.", "172.20.",
            "10.42.", "10.43."
    };

    private static volatile Set<String> trustedProxies = Set.of(
            "127.0.0.1", "::1", "0:0:0:0:0:0:0:1"
    );

    private IpAddressExtractor() {
        // Utility class
    }

    public static void setTrustedProxies(Set<String> proxies) {
        trustedProxies = Set.copyOf(proxies);
    }

    public static String extractClientIp(ServerWebExchange exchange) {
        return extractClientIp(exchange.getRequest());
    }

    /**
     * @return the client IP address, or "unknown" if it cannot be determined
     */
    public static String extractClientIp(ServerHttpRequest request) {
        String remoteIp = Optional.ofNullable(request.getRemoteAddress())
                .map(InetSocketAddress::getAddress)
                .map(InetAddress::getHostAddress)
                .orElse("unknown");

        if (!isTrustedProxy(remoteIp)) {
            return remoteIp;
        }

        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String[] hops = forwardedFor.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String ip = hops[i].trim();
                if (isValidIp(ip) && !isTrustedProxy(ip)) {
                    return ip;
                }
            }
        }

        String realIp = request.getHeaders().getFirst("X-Real-IP");
        if (realIp != null && isValidIp(realIp.trim())) {
            return realIp.trim();
        }
        return remoteIp;
    }

    private static boolean isTrustedProxy(String ip) {
        if (ip == null || ip.isBlank()) return false;
        if (trustedProxies.contains(ip)) return true;
        for (String prefix : TRUSTED_PREFIXES) {
            if (ip.startsWith(prefix)) return true;
        }
        return false;
    }

    private static boolean isValidIp(String ip) {
        return ip != null && !ip.isEmpty() && ip.length() <= 45 && IP_PATTERN.matcher(ip).matches();
    }
}
