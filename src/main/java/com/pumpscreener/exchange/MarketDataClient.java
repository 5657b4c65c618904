package com.pumpscreener.exchange;

import com.pumpscreener.exception.MarketDataException;
import com.pumpscreener.model.domain.Quote;

public interface MarketDataClient {

    /**
     * Fetches the latest price and 24h volume. Any transport or payload problem is
     * reported as {@link MarketDataException}; a returned quote always has a positive price.
     */
    Quote fetchQuote(String symbol) throws MarketDataException;

    String getSourceName();
}
