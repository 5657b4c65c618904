package com.pumpscreener.model.domain;

import java.math.BigDecimal;

public record Quote(
        String symbol,
        BigDecimal price,
        BigDecimal priceChangePercent24h,
        BigDecimal volume
) {
}
