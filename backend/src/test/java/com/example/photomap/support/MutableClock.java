package com.example.photomap.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

public class MutableClock extends Clock {

    private Instant current;
    private ZoneId zone = ZoneId.of("UTC");

    public MutableClock() {
        this(Instant.parse("2024-06-01T10:00:00Z"));
    }

    public MutableClock(Instant start) {
        this.current = start;
    }

    public void advanceSeconds(long seconds) {
        current = current.plusSeconds(seconds);
    }

    public void advance(Duration duration) {
        current = current.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        MutableClock copy = new MutableClock(current);
        copy.zone = zone;
        return copy;
    }

    @Override
    public Instant instant() {
        return current;
    }
}
