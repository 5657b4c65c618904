package com.pumpscreener.controller;

import com.pumpscreener.exception.InvalidSettingException;
import com.pumpscreener.model.dto.WatchlistRequest;
import com.pumpscreener.model.dto.WatchlistResponse;
import com.pumpscreener.service.watchlist.WatchlistService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/watchlist")
@RequiredArgsConstructor
public class WatchlistController {

    private final WatchlistService watchlistService;

    @GetMapping
    public List<String> getWatchlist() {
        return watchlistService.getSymbols();
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<Map<String, Object>> getSymbol(@PathVariable String symbol) {
        String normalized = WatchlistService.normalize(symbol);
        if (!watchlistService.contains(normalized)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.<String, Object>of(
                "symbol", normalized,
                "minVolumeUsd", watchlistService.minVolumeFor(normalized)
        ));
    }

    @PostMapping
    public ResponseEntity<WatchlistResponse> addSymbols(@RequestBody WatchlistRequest request) {
        if (request.symbols() == null || request.symbols().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        List<String> added = watchlistService.addAll(request.symbols());
        return ResponseEntity.ok(new WatchlistResponse(added, watchlistService.getSymbols()));
    }

    @ExceptionHandler(InvalidSettingException.class)
    public ResponseEntity<Map<String, String>> handleInvalidSymbol(InvalidSettingException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
