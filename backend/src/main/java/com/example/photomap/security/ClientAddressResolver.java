package com.example.photomap.security;

import com.example.photomap.config.RateLimitProps;
import com.example.photomap.exceptions.PhotoMapException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Derives the rate limiting key. Behind a trusted proxy the first {@code X-Forwarded-For} hop
 * wins, then {@code X-Real-IP}; with neither present the request is refused instead of being
 * counted under the proxy's own address.
 */
@Component
public class ClientAddressResolver {

    private final RateLimitProps rateLimitProps;

    public ClientAddressResolver(RateLimitProps rateLimitProps) {
        this.rateLimitProps = rateLimitProps;
    }

    public String resolve(HttpServletRequest request) {
        String remoteAddr = normalizeIp(request.getRemoteAddr());
        if (remoteAddr.isEmpty()) {
            remoteAddr = "unknown";
        }

        if (!rateLimitProps.isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null) {
            for (String part : forwardedFor.split(",")) {
                String candidate = normalizeIp(part);
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
        }

        String realIp = normalizeIp(request.getHeader("X-Real-IP"));
        if (!realIp.isEmpty()) {
            return realIp;
        }

        throw new PhotoMapException(PhotoMapException.Errors.MISSING_PROXY_HEADERS, "Missing required proxy headers");
    }

    private String normalizeIp(String ip) {
        if (ip == null) {
            return "";
        }
        return ip.trim().toLowerCase(Locale.ROOT);
    }
}
