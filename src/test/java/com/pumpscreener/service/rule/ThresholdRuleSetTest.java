package com.pumpscreener.service.rule;

import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.InvalidSettingException;
import com.pumpscreener.model.domain.DetectionRule;
import com.pumpscreener.model.enums.RuleField;
import com.pumpscreener.model.enums.SignalType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdRuleSetTest {

    private ThresholdRuleSet ruleSet;

    @BeforeEach
    void setUp() {
        ruleSet = new ThresholdRuleSet(new PumpScreenerProperties());
    }

    @Test
    void shouldLoadDefaultsFromProperties() {
        assertEquals(0, new BigDecimal("3.0").compareTo(ruleSet.get(SignalType.PUMP).thresholdPercent()));
        assertEquals(3, ruleSet.get(SignalType.PUMP).lookbackMinutes());
        assertEquals(0, new BigDecimal("20.0").compareTo(ruleSet.get(SignalType.SHORT_PUMP).thresholdPercent()));
        assertEquals(20, ruleSet.get(SignalType.SHORT_PUMP).lookbackMinutes());
        assertEquals(0, new BigDecimal("12.0").compareTo(ruleSet.get(SignalType.DUMP).thresholdPercent()));
        assertEquals(4, ruleSet.get(SignalType.DUMP).lookbackMinutes());
    }

    @Test
    void shouldClampLookbackBelowOneMinute() {
        assertEquals(1, ruleSet.setLookbackMinutes(SignalType.PUMP, 0).lookbackMinutes());
        assertEquals(1, ruleSet.setLookbackMinutes(SignalType.DUMP, -10).lookbackMinutes());
        assertEquals(1, ruleSet.get(SignalType.PUMP).lookbackMinutes());
    }

    @Test
    void shouldUpdateOneFieldAndKeepTheOther() {
        ruleSet.setThresholdPercent(SignalType.DUMP, new BigDecimal("8.5"));

        DetectionRule dump = ruleSet.get(SignalType.DUMP);
        assertEquals(new BigDecimal("8.5"), dump.thresholdPercent());
        assertEquals(4, dump.lookbackMinutes());
    }

    @Test
    void shouldAcceptZeroOrNegativeThresholdAsDisabled() {
        ruleSet.setThresholdPercent(SignalType.PUMP, BigDecimal.ZERO);
        ruleSet.setThresholdPercent(SignalType.SHORT_PUMP, new BigDecimal("-1"));

        assertFalse(ruleSet.get(SignalType.PUMP).isEnabled());
        assertFalse(ruleSet.get(SignalType.SHORT_PUMP).isEnabled());
        assertTrue(ruleSet.get(SignalType.DUMP).isEnabled());
    }

    @Test
    void shouldApplyNumericUserInput() {
        ruleSet.applyUserInput(SignalType.PUMP, RuleField.THRESHOLD, " 3.5 ");
        ruleSet.applyUserInput(SignalType.PUMP, RuleField.LOOKBACK, "7.9");

        assertEquals(new BigDecimal("3.5"), ruleSet.get(SignalType.PUMP).thresholdPercent());
        assertEquals(7, ruleSet.get(SignalType.PUMP).lookbackMinutes());
    }

    @Test
    void shouldClampFractionalLookbackInputBelowOne() {
        ruleSet.applyUserInput(SignalType.SHORT_PUMP, RuleField.LOOKBACK, "0.5");

        assertEquals(1, ruleSet.get(SignalType.SHORT_PUMP).lookbackMinutes());
    }

    @Test
    void shouldClampLookbackInputWithExtremeExponent() {
        assertEquals(Integer.MAX_VALUE,
                ruleSet.applyUserInput(SignalType.PUMP, RuleField.LOOKBACK, "1e999999999").lookbackMinutes());
        assertEquals(1,
                ruleSet.applyUserInput(SignalType.DUMP, RuleField.LOOKBACK, "1e-999999999").lookbackMinutes());
        assertEquals(1,
                ruleSet.applyUserInput(SignalType.SHORT_PUMP, RuleField.LOOKBACK, "-1e999999999").lookbackMinutes());
    }

    @Test
    void shouldRejectNonNumericInputAndKeepPreviousValue() {
        DetectionRule before = ruleSet.get(SignalType.DUMP);

        assertThrows(InvalidSettingException.class,
                () -> ruleSet.applyUserInput(SignalType.DUMP, RuleField.THRESHOLD, "twelve"));
        assertThrows(InvalidSettingException.class,
                () -> ruleSet.applyUserInput(SignalType.DUMP, RuleField.LOOKBACK, ""));
        assertThrows(InvalidSettingException.class,
                () -> ruleSet.applyUserInput(SignalType.DUMP, RuleField.THRESHOLD, "NaN"));

        assertEquals(before, ruleSet.get(SignalType.DUMP));
    }

    @Test
    void shouldReturnIndependentCopyOfAllRules() {
        var all = ruleSet.getAll();
        ruleSet.setThresholdPercent(SignalType.PUMP, new BigDecimal("9"));

        assertEquals(3, all.size());
        assertEquals(0, new BigDecimal("3.0").compareTo(all.get(SignalType.PUMP).thresholdPercent()));
    }
}
