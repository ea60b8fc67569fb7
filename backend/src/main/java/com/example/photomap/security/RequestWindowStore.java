package com.example.photomap.security;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request counters keyed by client. The default lives in process memory, so each
 * instance of the service counts on its own; a shared implementation is needed behind a load
 * balancer.
 */
public interface RequestWindowStore {

    /** Counts one request for {@code key}; returns {@code false} once the window is full. */
    boolean tryAcquire(String key, Instant now, Duration window, int maxRequests);

    /** Drops windows that ended before {@code now}; returns how many were removed. */
    int purgeExpired(Instant now, Duration window);
}
