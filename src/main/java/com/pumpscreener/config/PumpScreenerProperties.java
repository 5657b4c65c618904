package com.pumpscreener.config;

import com.pumpscreener.model.config.RuleConfig;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "pumpscreener")
public class PumpScreenerProperties {

    private TelegramConfig telegram = new TelegramConfig();
    private BinanceConfig binance = new BinanceConfig();
    private ScanConfig scan = new ScanConfig();
    private RulesConfig rules = new RulesConfig();

    @PostConstruct
    public void validate() {
        if (telegram.isEnabled()) {
            if (telegram.getBotToken() == null || telegram.getBotToken().isBlank()) {
                throw new IllegalStateException("pumpscreener.telegram.bot-token is required (TELEGRAM_BOT_TOKEN)");
            }
            if (telegram.getChatIds() == null || telegram.getChatIds().stream().allMatch(String::isBlank)) {
                throw new IllegalStateException("pumpscreener.telegram.chat-ids is required (ADMIN_CHAT_ID)");
            }
        }
        if (scan.getWatchlist() == null || scan.getWatchlist().isEmpty()) {
            throw new IllegalStateException("pumpscreener.scan.watchlist must contain at least one symbol");
        }
        if (scan.getIntervalSeconds() <= 0) {
            throw new IllegalStateException("pumpscreener.scan.interval-seconds must be positive");
        }
        if (scan.getRetentionMinutes() <= 0) {
            throw new IllegalStateException("pumpscreener.scan.retention-minutes must be positive");
        }
    }

    @Data
    public static class TelegramConfig {
        private String botToken;
        private List<String> chatIds = new ArrayList<>();
        private String apiUrl = "https://api.telegram.org";
        private boolean enabled = true;
    }

    @Data
    public static class BinanceConfig {
        private String baseUrl = "https://fapi.binance.com";
        private int timeoutSeconds = 5;
    }

    @Data
    public static class ScanConfig {
        private int intervalSeconds = 60;
        private long symbolDelayMs = 500;
        private int retentionMinutes = 30;
        private BigDecimal minVolumeUsd = new BigDecimal("1000000");
        private List<String> watchlist = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "PEPEUSDT"));
    }

    @Data
    public static class RulesConfig {
        private RuleConfig pump = new RuleConfig(new BigDecimal("3.0"), 3);
        private RuleConfig shortPump = new RuleConfig(new BigDecimal("20.0"), 20);
        private RuleConfig dump = new RuleConfig(new BigDecimal("12.0"), 4);
    }
}
