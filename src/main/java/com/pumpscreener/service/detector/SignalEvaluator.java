package com.pumpscreener.service.detector;

import com.pumpscreener.model.domain.Alert;
import com.pumpscreener.model.domain.DetectionRule;
import com.pumpscreener.model.domain.PriceSample;
import com.pumpscreener.model.enums.SignalType;
import com.pumpscreener.service.history.PriceHistoryStore;
import com.pumpscreener.service.rule.ThresholdRuleSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares the current price of a symbol against the last sample taken before each
 * rule's lookback boundary. Rules are independent: any combination may fire in the
 * same cycle, and a sustained move fires again on every cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalEvaluator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int PERCENT_SCALE = 8;

    private final PriceHistoryStore priceHistoryStore;
    private final ThresholdRuleSet ruleSet;

    public List<Alert> evaluate(String symbol, PriceSample current, BigDecimal volume) {
        List<Alert> alerts = new ArrayList<>();
        for (SignalType type : SignalType.values()) {
            evaluateRule(symbol, type, ruleSet.get(type), current, volume).ifPresent(alerts::add);
        }
        return alerts;
    }

    Optional<Alert> evaluateRule(String symbol, SignalType type, DetectionRule rule,
                                 PriceSample current, BigDecimal volume) {
        if (!rule.isEnabled()) {
            return Optional.empty();
        }

        Instant cutoff = current.timestamp().minus(Duration.ofMinutes(rule.lookbackMinutes()));
        Optional<PriceSample> baseline = priceHistoryStore.baselineAtOrBefore(symbol, cutoff);
        if (baseline.isEmpty()) {
            log.debug("[{}] {}: no sample at or before {}, skipping", symbol, type, cutoff);
            return Optional.empty();
        }

        BigDecimal basePrice = baseline.get().price();
        BigDecimal price = current.price();

        BigDecimal move;
        if (type.isRising()) {
            if (price.compareTo(basePrice) <= 0) {
                return Optional.empty();
            }
            move = price.subtract(basePrice);
        } else {
            if (price.compareTo(basePrice) >= 0) {
                return Optional.empty();
            }
            move = basePrice.subtract(price);
        }

        // move * 100 >= threshold * base, decided before any rounding
        if (move.multiply(HUNDRED).compareTo(rule.thresholdPercent().multiply(basePrice)) < 0) {
            return Optional.empty();
        }

        BigDecimal pct = move.divide(basePrice, PERCENT_SCALE, RoundingMode.HALF_UP).multiply(HUNDRED);

        BigDecimal signedPct = type.isRising() ? pct : pct.negate();
        log.info("[{}] {} fired: {} -> {} ({}% over {} min, threshold {}%)",
                symbol, type, basePrice.toPlainString(), price.toPlainString(),
                signedPct.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                rule.lookbackMinutes(), rule.thresholdPercent().toPlainString());

        return Optional.of(new Alert(
                symbol,
                type,
                price,
                basePrice,
                signedPct,
                volume,
                current.timestamp()
        ));
    }
}
