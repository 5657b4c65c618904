package com.pumpscreener.model.dto;

public record SettingValueRequest(
        String value
) {
}
