package com.pumpscreener.model.dto;

import java.util.List;

public record WatchlistRequest(
        List<String> symbols
) {
}
