package com.pumpscreener.service.scan;

import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.AlertDeliveryException;
import com.pumpscreener.exception.MarketDataException;
import com.pumpscreener.exchange.MarketDataClient;
import com.pumpscreener.model.domain.Alert;
import com.pumpscreener.model.domain.CycleReport;
import com.pumpscreener.model.domain.PriceSample;
import com.pumpscreener.model.domain.Quote;
import com.pumpscreener.service.alert.AlertDispatcher;
import com.pumpscreener.service.detector.SignalEvaluator;
import com.pumpscreener.service.history.PriceHistoryStore;
import com.pumpscreener.service.watchlist.WatchlistService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One scan over the watchlist: fetch, volume filter, record, evaluate, dispatch.
 * Symbols are processed one at a time with a fixed pause between them to bound
 * the request rate against the market-data source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PollingCycle {

    private final WatchlistService watchlist;
    private final MarketDataClient marketDataClient;
    private final PriceHistoryStore priceHistoryStore;
    private final SignalEvaluator signalEvaluator;
    private final AlertDispatcher alertDispatcher;
    private final PumpScreenerProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private volatile boolean stopping;

    @Scheduled(fixedRateString = "${pumpscreener.scan.interval-seconds:60}", timeUnit = TimeUnit.SECONDS)
    public void scheduledScan() {
        if (stopping) {
            return;
        }
        runCycle();
    }

    /**
     * @return the report of the completed cycle, or empty if another cycle was still running
     */
    public Optional<CycleReport> runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous scan still in progress, skipping this trigger");
            return Optional.empty();
        }
        try {
            CycleReport report = scan();
            lastReport.set(report);
            log.info("=== Scan finished in {}ms: {}/{} sampled, {} low volume, {} failed, {} alerts ({} undelivered) ===",
                    report.durationMs(), report.sampled(), report.watched(), report.skippedLowVolume(),
                    report.failed(), report.alerts(), report.deliveryFailures());
            return Optional.of(report);
        } finally {
            running.set(false);
        }
    }

    private CycleReport scan() {
        Instant startedAt = clock.instant();
        List<String> symbols = watchlist.getSymbols();
        log.info("Scanning {} symbols on {}: {}", symbols.size(), marketDataClient.getSourceName(), symbols);

        int sampled = 0;
        int skippedLowVolume = 0;
        int failed = 0;
        int alertCount = 0;
        int deliveryFailures = 0;

        for (int i = 0; i < symbols.size(); i++) {
            if (stopping) {
                log.info("Shutdown requested, stopping scan after {} of {} symbols", i, symbols.size());
                break;
            }
            String symbol = symbols.get(i);

            Quote quote;
            try {
                quote = marketDataClient.fetchQuote(symbol);
            } catch (MarketDataException e) {
                log.warn("[{}] Skipping this cycle: {}", symbol, e.getMessage());
                failed++;
                if (!pauseBetweenSymbols(i, symbols.size())) {
                    break;
                }
                continue;
            }

            BigDecimal minVolume = watchlist.minVolumeFor(symbol);
            if (quote.volume().compareTo(minVolume) < 0) {
                log.debug("[{}] Skipped: volume {} < {}", symbol,
                        quote.volume().toPlainString(), minVolume.toPlainString());
                skippedLowVolume++;
            } else {
                PriceSample sample = new PriceSample(clock.instant(), quote.price());
                priceHistoryStore.append(symbol, sample);
                priceHistoryStore.prune(symbol, sample.timestamp());
                sampled++;

                List<Alert> alerts = signalEvaluator.evaluate(symbol, sample, quote.volume());
                for (Alert alert : alerts) {
                    alertCount++;
                    try {
                        alertDispatcher.deliver(alert);
                    } catch (AlertDeliveryException e) {
                        deliveryFailures++;
                        log.error("[{}] Failed to deliver {} alert: {}", symbol, alert.signalType(), e.getMessage());
                    }
                }
            }

            if (!pauseBetweenSymbols(i, symbols.size())) {
                break;
            }
        }

        return new CycleReport(startedAt, clock.instant(), symbols.size(),
                sampled, skippedLowVolume, failed, alertCount, deliveryFailures);
    }

    private boolean pauseBetweenSymbols(int index, int total) {
        long delayMs = properties.getScan().getSymbolDelayMs();
        if (index >= total - 1 || delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Scan interrupted, stopping after {} of {} symbols", index + 1, total);
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        log.info("Polling stopped, no further scans will be scheduled");
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public boolean isRunning() {
        return running.get();
    }
}
