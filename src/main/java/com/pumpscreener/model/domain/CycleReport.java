package com.pumpscreener.model.domain;

import java.time.Duration;
import java.time.Instant;

public record CycleReport(
        Instant startedAt,
        Instant finishedAt,
        int watched,
        int sampled,
        int skippedLowVolume,
        int failed,
        int alerts,
        int deliveryFailures
) {
    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
