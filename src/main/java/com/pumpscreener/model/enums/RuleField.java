package com.pumpscreener.model.enums;

import com.pumpscreener.exception.InvalidSettingException;

import java.util.Arrays;

public enum RuleField {
    THRESHOLD("threshold"),
    LOOKBACK("lookback");

    private final String pathName;

    RuleField(String pathName) {
        this.pathName = pathName;
    }

    public String getPathName() {
        return pathName;
    }

    public static RuleField fromPathName(String value) {
        return Arrays.stream(values())
                .filter(f -> f.pathName.equalsIgnoreCase(value) || f.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new InvalidSettingException("Unknown rule field: " + value));
    }
}
