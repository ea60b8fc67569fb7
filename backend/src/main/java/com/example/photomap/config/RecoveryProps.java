package com.example.photomap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.auth.recovery")
public class RecoveryProps {

    private Duration codeTtl = Duration.ofMinutes(10);
    private int maxAttempts = 5;
    private Duration minResponseDelay = Duration.ofMillis(50);
    private Duration maxResponseDelay = Duration.ofMillis(150);

    public Duration getCodeTtl() {
        return codeTtl;
    }

    public void setCodeTtl(Duration codeTtl) {
        this.codeTtl = codeTtl;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public Duration getMinResponseDelay() {
        return minResponseDelay;
    }

    public void setMinResponseDelay(Duration minResponseDelay) {
        this.minResponseDelay = minResponseDelay;
    }

    public Duration getMaxResponseDelay() {
        return maxResponseDelay;
    }

    public void setMaxResponseDelay(Duration maxResponseDelay) {
        this.maxResponseDelay = maxResponseDelay;
    }
}
