package com.pumpscreener.service.history;

import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.model.domain.PriceSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling price log per symbol. Samples are appended in non-decreasing time order,
 * so stale entries are always at the head of the deque.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceHistoryStore {

    private final PumpScreenerProperties properties;

    private final Map<String, Deque<PriceSample>> priceHistory = new ConcurrentHashMap<>();

    public void append(String symbol, PriceSample sample) {
        Deque<PriceSample> history = priceHistory.computeIfAbsent(buildKey(symbol), k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(sample);
        }
    }

    public int prune(String symbol, Instant now) {
        return prune(symbol, now, getRetention());
    }

    /**
     * Drops every sample with {@code timestamp <= now - retention}.
     *
     * @return number of removed samples
     */
    public int prune(String symbol, Instant now, Duration retention) {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("Retention must be positive, got " + retention);
        }

        Deque<PriceSample> history = priceHistory.get(buildKey(symbol));
        if (history == null) {
            return 0;
        }

        Instant cutoff = now.minus(retention);
        int removed = 0;
        synchronized (history) {
            while (!history.isEmpty() && !history.peekFirst().timestamp().isAfter(cutoff)) {
                history.pollFirst();
                removed++;
            }
        }

        if (removed > 0) {
            log.debug("[{}] Pruned {} samples older than {}", symbol, removed, cutoff);
        }
        return removed;
    }

    /**
     * Most recent sample taken at or before {@code cutoff}. Empty when the history
     * does not reach back that far.
     */
    public Optional<PriceSample> baselineAtOrBefore(String symbol, Instant cutoff) {
        Deque<PriceSample> history = priceHistory.get(buildKey(symbol));
        if (history == null) {
            return Optional.empty();
        }

        synchronized (history) {
            Iterator<PriceSample> it = history.descendingIterator();
            while (it.hasNext()) {
                PriceSample sample = it.next();
                if (!sample.timestamp().isAfter(cutoff)) {
                    return Optional.of(sample);
                }
            }
        }
        return Optional.empty();
    }

    public List<PriceSample> snapshot(String symbol) {
        Deque<PriceSample> history = priceHistory.get(buildKey(symbol));
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public int size(String symbol) {
        Deque<PriceSample> history = priceHistory.get(buildKey(symbol));
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public int getTrackedSymbolsCount() {
        return priceHistory.size();
    }

    public Duration getRetention() {
        return Duration.ofMinutes(properties.getScan().getRetentionMinutes());
    }

    private String buildKey(String symbol) {
        return symbol.toUpperCase();
    }
}
