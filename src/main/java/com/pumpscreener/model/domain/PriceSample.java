package com.pumpscreener.model.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record PriceSample(
        Instant timestamp,
        BigDecimal price
) {
    public PriceSample {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(price, "price");
    }
}
