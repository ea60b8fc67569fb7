package com.example.photomap.security;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class InMemoryRequestWindowStore implements RequestWindowStore {

    private final Map<String, RequestWindow> windows = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String key, Instant now, Duration window, int maxRequests) {
        AtomicBoolean allowed = new AtomicBoolean(true);

        windows.compute(key, (k, current) -> {
            if (current == null || now.isAfter(current.windowStart().plus(window))) {
                allowed.set(true);
                return new RequestWindow(now, 1);
            }

            if (current.count() >= maxRequests) {
                allowed.set(false);
                return current;
            }

            allowed.set(true);
            return new RequestWindow(current.windowStart(), current.count() + 1);
        });

        return allowed.get();
    }

    @Override
    public int purgeExpired(Instant now, Duration window) {
        int before = windows.size();
        windows.entrySet().removeIf(entry -> now.isAfter(entry.getValue().windowStart().plus(window)));
        return Math.max(0, before - windows.size());
    }

    int size() {
        return windows.size();
    }

    private record RequestWindow(Instant windowStart, int count) { }
}
