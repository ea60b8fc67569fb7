package com.example.photomap.security;

import com.example.photomap.config.RateLimitProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final RateLimitProps props;
    private final RequestWindowStore store;
    private final Clock clock;

    public RateLimiterService(RateLimitProps props, RequestWindowStore store, Clock clock) {
        this.props = props;
        this.store = store;
        this.clock = clock;
    }

    public boolean isAllowed(String key) {
        if (key == null || key.isBlank()) {
            return true;
        }
        return store.tryAcquire(key, clock.instant(), props.getWindow(), props.getMaxRequests());
    }

    @Scheduled(fixedDelayString = "${app.auth.rate-limit.sweep-interval-ms:60000}")
    public void purgeExpiredWindows() {
        int removed = store.purgeExpired(clock.instant(), props.getWindow());
        if (removed > 0) {
            log.debug("Removed {} expired rate limit windows", removed);
        }
    }
}
