package com.example.photomap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "app.auth.rate-limit")
public class RateLimitProps {

    private int maxRequests = 10;
    private Duration window = Duration.ofSeconds(60);

    /**
     * When set, the client address is taken from {@code X-Forwarded-For} / {@code X-Real-IP}
     * and a request carrying neither is rejected.
     */
    private boolean trustProxy = false;

    /** Optional allow-list of proxy peers; empty means every peer is treated as the proxy. */
    private final List<String> trustedProxies = new ArrayList<>();

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = Math.max(1, maxRequests);
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window == null || window.isZero() || window.isNegative() ? Duration.ofSeconds(60) : window;
    }

    public boolean isTrustProxy() {
        return trustProxy;
    }

    public void setTrustProxy(boolean trustProxy) {
        this.trustProxy = trustProxy;
    }

    public List<String> getTrustedProxies() {
        return Collections.unmodifiableList(trustedProxies);
    }

    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies.clear();
        if (trustedProxies == null) {
            return;
        }
        for (String proxy : trustedProxies) {
            String normalized = normalize(proxy);
            if (!normalized.isEmpty()) {
                this.trustedProxies.add(normalized);
            }
        }
    }

    public boolean isTrustedProxy(String candidate) {
        if (!trustProxy) {
            return false;
        }
        if (trustedProxies.isEmpty()) {
            return true;
        }
        String normalized = normalize(candidate);
        return !normalized.isEmpty() && trustedProxies.contains(normalized);
    }

    private String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
