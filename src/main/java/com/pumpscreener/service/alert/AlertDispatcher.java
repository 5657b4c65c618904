package com.pumpscreener.service.alert;

import com.pumpscreener.exception.AlertDeliveryException;
import com.pumpscreener.model.domain.Alert;

public interface AlertDispatcher {

    /**
     * Delivers one alert. Implementations do not retry; the caller decides what a
     * failure means.
     */
    void deliver(Alert alert) throws AlertDeliveryException;
}
