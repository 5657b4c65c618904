package com.pumpscreener.model.dto;

import com.pumpscreener.model.domain.DetectionRule;
import com.pumpscreener.model.enums.SignalType;

import java.math.BigDecimal;
import java.util.Map;

public record SettingsResponse(
        Map<SignalType, DetectionRule> rules,
        BigDecimal minVolumeUsd
) {
}
