package com.esign.search.model;

import java.time.Duration;
import java.time.Instant;

public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("time range bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("time range end must not precede start");
        }
    }

    public static TimeRange lastDays(int days) {
        Instant now = Instant.now();
        return new TimeRange(now.minus(Duration.ofDays(days)), now);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
