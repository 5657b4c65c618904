package com.pumpscreener.model.domain;

import com.pumpscreener.model.enums.SignalType;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A fired signal. {@code percentChange} is negative for {@link SignalType#DUMP}.
 */
public record Alert(
        String symbol,
        SignalType signalType,
        BigDecimal currentPrice,
        BigDecimal baselinePrice,
        BigDecimal percentChange,
        BigDecimal volume,
        Instant timestamp
) {
}
