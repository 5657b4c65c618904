package com.pumpscreener.controller;

import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.MarketDataException;
import com.pumpscreener.exchange.MarketDataClient;
import com.pumpscreener.model.domain.Quote;
import com.pumpscreener.service.alert.AlertDispatcher;
import com.pumpscreener.service.detector.SignalEvaluator;
import com.pumpscreener.service.history.PriceHistoryStore;
import com.pumpscreener.service.rule.ThresholdRuleSet;
import com.pumpscreener.service.scan.PollingCycle;
import com.pumpscreener.service.watchlist.WatchlistService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class StatusControllerTest {

    @Mock
    private MarketDataClient marketDataClient;

    @Mock
    private AlertDispatcher alertDispatcher;

    private PollingCycle pollingCycle;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PumpScreenerProperties properties = new PumpScreenerProperties();
        properties.getScan().setSymbolDelayMs(0);
        properties.getScan().setWatchlist(List.of("BTCUSDT", "ETHUSDT"));

        PriceHistoryStore priceHistoryStore = new PriceHistoryStore(properties);
        WatchlistService watchlist = new WatchlistService(properties);
        SignalEvaluator evaluator = new SignalEvaluator(priceHistoryStore, new ThresholdRuleSet(properties));
        pollingCycle = new PollingCycle(watchlist, marketDataClient, priceHistoryStore, evaluator,
                alertDispatcher, properties, Clock.fixed(Instant.parse("2025-03-10T09:30:00Z"), ZoneOffset.UTC));

        mockMvc = MockMvcBuilders.standaloneSetup(
                new StatusController(watchlist, priceHistoryStore, pollingCycle)
        ).build();
    }

    @Test
    void shouldReportNoScanBeforeFirstCycle() throws Exception {
        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.watchedSymbols").value(2))
                .andExpect(jsonPath("$.trackedHistories").value(0))
                .andExpect(jsonPath("$.scanRunning").value(false))
                .andExpect(jsonPath("$.lastScan").doesNotExist());
    }

    @Test
    void shouldReportLastCycleSummary() throws Exception {
        when(marketDataClient.fetchQuote("BTCUSDT")).thenReturn(new Quote("BTCUSDT",
                new BigDecimal("100"), BigDecimal.ZERO, new BigDecimal("5000000")));
        when(marketDataClient.fetchQuote("ETHUSDT")).thenThrow(new MarketDataException("timeout"));

        pollingCycle.runCycle();

        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.watchedSymbols").value(2))
                .andExpect(jsonPath("$.trackedHistories").value(1))
                .andExpect(jsonPath("$.scanRunning").value(false))
                .andExpect(jsonPath("$.lastScan.watched").value(2))
                .andExpect(jsonPath("$.lastScan.sampled").value(1))
                .andExpect(jsonPath("$.lastScan.failed").value(1))
                .andExpect(jsonPath("$.lastScan.alerts").value(0));
        verifyNoInteractions(alertDispatcher);
    }
}
