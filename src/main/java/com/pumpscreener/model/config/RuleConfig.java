package com.pumpscreener.model.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleConfig {
    private BigDecimal percent;
    private int periodMinutes;
}
