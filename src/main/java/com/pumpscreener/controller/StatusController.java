package com.pumpscreener.controller;

import com.pumpscreener.service.history.PriceHistoryStore;
import com.pumpscreener.service.scan.PollingCycle;
import com.pumpscreener.service.watchlist.WatchlistService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
public class StatusController {

    private final WatchlistService watchlistService;
    private final PriceHistoryStore priceHistoryStore;
    private final PollingCycle pollingCycle;

    @GetMapping
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("watchedSymbols", watchlistService.size());
        status.put("trackedHistories", priceHistoryStore.getTrackedSymbolsCount());
        status.put("scanRunning", pollingCycle.isRunning());
        pollingCycle.getLastReport().ifPresent(report -> status.put("lastScan", report));
        return status;
    }
}
