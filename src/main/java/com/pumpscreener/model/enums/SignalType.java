package com.pumpscreener.model.enums;

import com.pumpscreener.exception.InvalidSettingException;

import java.util.Arrays;

public enum SignalType {
    PUMP("Pump", "🟢", true),
    SHORT_PUMP("Short", "🟡", true),
    DUMP("Dump", "🔴", false);

    private final String displayName;
    private final String emoji;
    private final boolean rising;

    SignalType(String displayName, String emoji, boolean rising) {
        this.displayName = displayName;
        this.emoji = emoji;
        this.rising = rising;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getEmoji() {
        return emoji;
    }

    /**
     * Whether the signal fires on a price increase relative to the baseline.
     */
    public boolean isRising() {
        return rising;
    }

    /**
     * Accepts {@code short-pump}, {@code short_pump} or {@code SHORT_PUMP}.
     */
    public static SignalType fromPathName(String value) {
        String normalized = value == null ? "" : value.trim().replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidSettingException("Unknown signal type: " + value));
    }
}
