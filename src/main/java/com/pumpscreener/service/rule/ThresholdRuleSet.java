package com.pumpscreener.service.rule;

import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.InvalidSettingException;
import com.pumpscreener.model.config.RuleConfig;
import com.pumpscreener.model.domain.DetectionRule;
import com.pumpscreener.model.enums.RuleField;
import com.pumpscreener.model.enums.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class ThresholdRuleSet {

    private final Map<SignalType, DetectionRule> rules = new ConcurrentHashMap<>();

    public ThresholdRuleSet(PumpScreenerProperties properties) {
        PumpScreenerProperties.RulesConfig config = properties.getRules();
        rules.put(SignalType.PUMP, fromConfig(config.getPump()));
        rules.put(SignalType.SHORT_PUMP, fromConfig(config.getShortPump()));
        rules.put(SignalType.DUMP, fromConfig(config.getDump()));
    }

    public DetectionRule get(SignalType type) {
        return rules.get(type);
    }

    public Map<SignalType, DetectionRule> getAll() {
        Map<SignalType, DetectionRule> copy = new EnumMap<>(SignalType.class);
        copy.putAll(rules);
        return copy;
    }

    /**
     * Zero or negative disables the rule.
     */
    public DetectionRule setThresholdPercent(SignalType type, BigDecimal thresholdPercent) {
        if (thresholdPercent == null) {
            throw new InvalidSettingException("Threshold for " + type + " must not be empty");
        }
        DetectionRule updated = rules.compute(type, (k, current) -> current.withThresholdPercent(thresholdPercent));
        log.info("Rule {} threshold set to {}%", type, thresholdPercent.toPlainString());
        return updated;
    }

    /**
     * Values below one minute are clamped to one.
     */
    public DetectionRule setLookbackMinutes(SignalType type, int lookbackMinutes) {
        int clamped = Math.max(1, lookbackMinutes);
        DetectionRule updated = rules.compute(type, (k, current) -> current.withLookbackMinutes(clamped));
        log.info("Rule {} lookback set to {} min", type, clamped);
        return updated;
    }

    /**
     * Applies raw text entered by a user. Non-numeric input is rejected and the
     * current rule is left as is.
     */
    public DetectionRule applyUserInput(SignalType type, RuleField field, String rawValue) {
        BigDecimal value = parseDecimal(rawValue);
        return switch (field) {
            case THRESHOLD -> setThresholdPercent(type, value);
            case LOOKBACK -> setLookbackMinutes(type, toMinutes(value));
        };
    }

    static BigDecimal parseDecimal(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidSettingException("Enter a number (for example: 3.5)");
        }
        try {
            return new BigDecimal(rawValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSettingException("Enter a number (for example: 3.5), got '" + rawValue.trim() + "'", e);
        }
    }

    private static int toMinutes(BigDecimal value) {
        // range checks first: setScale on a huge exponent overflows
        if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) >= 0) {
            return Integer.MAX_VALUE;
        }
        if (value.compareTo(BigDecimal.ONE) < 0) {
            return 1;
        }
        return value.setScale(0, RoundingMode.DOWN).intValueExact();
    }

    private static DetectionRule fromConfig(RuleConfig config) {
        BigDecimal percent = config.getPercent() != null ? config.getPercent() : BigDecimal.ZERO;
        return new DetectionRule(percent, Math.max(1, config.getPeriodMinutes()));
    }
}
