package com.pumpscreener.model.dto;

import java.util.List;

public record WatchlistResponse(
        List<String> added,
        List<String> watchlist
) {
}
