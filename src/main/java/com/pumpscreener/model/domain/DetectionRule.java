package com.pumpscreener.model.domain;

import java.math.BigDecimal;

/**
 * Threshold and lookback of one signal type. Replaced as a whole on every edit.
 */
public record DetectionRule(
        BigDecimal thresholdPercent,
        int lookbackMinutes
) {
    public boolean isEnabled() {
        return thresholdPercent.compareTo(BigDecimal.ZERO) > 0;
    }

    public DetectionRule withThresholdPercent(BigDecimal value) {
        return new DetectionRule(value, lookbackMinutes);
    }

    public DetectionRule withLookbackMinutes(int value) {
        return new DetectionRule(thresholdPercent, value);
    }
}
