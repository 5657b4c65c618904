package com.pumpscreener.controller;

import com.pumpscreener.exception.InvalidSettingException;
import com.pumpscreener.model.domain.DetectionRule;
import com.pumpscreener.model.dto.SettingValueRequest;
import com.pumpscreener.model.dto.SettingsResponse;
import com.pumpscreener.model.enums.RuleField;
import com.pumpscreener.model.enums.SignalType;
import com.pumpscreener.service.rule.ThresholdRuleSet;
import com.pumpscreener.service.watchlist.WatchlistService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final ThresholdRuleSet ruleSet;
    private final WatchlistService watchlistService;

    @GetMapping
    public SettingsResponse getSettings() {
        return new SettingsResponse(ruleSet.getAll(), watchlistService.getMinVolumeUsd());
    }

    @GetMapping("/rules/{type}")
    public DetectionRule getRule(@PathVariable String type) {
        return ruleSet.get(SignalType.fromPathName(type));
    }

    @PutMapping("/rules/{type}/{field}")
    public DetectionRule updateRule(@PathVariable String type,
                                    @PathVariable String field,
                                    @RequestBody SettingValueRequest request) {
        return ruleSet.applyUserInput(
                SignalType.fromPathName(type),
                RuleField.fromPathName(field),
                request.value());
    }

    @PutMapping("/min-volume")
    public SettingsResponse updateMinVolume(@RequestBody SettingValueRequest request) {
        BigDecimal value;
        try {
            value = new BigDecimal(request.value() == null ? "" : request.value().trim());
        } catch (NumberFormatException e) {
            throw new InvalidSettingException("Enter a number (for example: 1000000)", e);
        }
        watchlistService.setMinVolumeUsd(value);
        return getSettings();
    }

    @ExceptionHandler(InvalidSettingException.class)
    public ResponseEntity<Map<String, String>> handleInvalidSetting(InvalidSettingException e) {
        log.warn("Rejected settings update: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
