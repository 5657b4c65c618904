package com.pumpscreener.service.watchlist;

import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.InvalidSettingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
public class WatchlistService {

    private static final String QUOTE_ASSET = "USDT";

    // insertion-ordered, safe to iterate while the settings surface adds symbols
    private final Set<String> symbols = new CopyOnWriteArraySet<>();
    private final AtomicReference<BigDecimal> minVolumeUsd;

    public WatchlistService(PumpScreenerProperties properties) {
        PumpScreenerProperties.ScanConfig scan = properties.getScan();
        this.minVolumeUsd = new AtomicReference<>(scan.getMinVolumeUsd());
        for (String symbol : scan.getWatchlist()) {
            if (symbol != null && !symbol.isBlank()) {
                symbols.add(normalize(symbol));
            }
        }
        log.info("Watchlist initialised with {} symbols: {}", symbols.size(), symbols);
    }

    /**
     * @return true if the symbol was not watched before
     */
    public boolean add(String symbol) {
        String normalized = normalize(symbol);
        boolean added = symbols.add(normalized);
        if (added) {
            log.info("Added {} to watchlist", normalized);
        }
        return added;
    }

    /**
     * All symbols are validated before any is added, so an invalid entry leaves the
     * watchlist unchanged.
     *
     * @return the normalised symbols that were newly added, in input order
     */
    public List<String> addAll(Collection<String> rawSymbols) {
        List<String> normalizedBatch = new ArrayList<>(rawSymbols.size());
        for (String raw : rawSymbols) {
            normalizedBatch.add(normalize(raw));
        }

        List<String> added = new ArrayList<>();
        for (String normalized : normalizedBatch) {
            if (symbols.add(normalized)) {
                added.add(normalized);
            }
        }
        if (!added.isEmpty()) {
            log.info("Added symbols to watchlist: {}", added);
        }
        return added;
    }

    public boolean contains(String symbol) {
        return symbols.contains(normalize(symbol));
    }

    public List<String> getSymbols() {
        return List.copyOf(symbols);
    }

    public int size() {
        return symbols.size();
    }

    /**
     * Minimum 24h quote volume for a symbol. Currently one global floor.
     */
    public BigDecimal minVolumeFor(String symbol) {
        return minVolumeUsd.get();
    }

    public BigDecimal getMinVolumeUsd() {
        return minVolumeUsd.get();
    }

    public void setMinVolumeUsd(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidSettingException("Minimum volume must be a non-negative number");
        }
        minVolumeUsd.set(value);
        log.info("Minimum volume set to ${}", value.toPlainString());
    }

    /**
     * BTC, btcusdt and BTCUSDT all map to BTCUSDT.
     */
    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidSettingException("Symbol must not be empty");
        }
        String base = symbol.trim().toUpperCase().replace(QUOTE_ASSET, "");
        if (base.isEmpty() || !base.chars().allMatch(Character::isLetterOrDigit)) {
            throw new InvalidSettingException("Invalid symbol: " + symbol.trim());
        }
        return base + QUOTE_ASSET;
    }
}
