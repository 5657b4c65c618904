package com.pumpscreener.service.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pumpscreener.config.PumpScreenerProperties;
import com.pumpscreener.exception.AlertDeliveryException;
import com.pumpscreener.model.domain.Alert;
import com.pumpscreener.service.alert.AlertDispatcher;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramAlertDispatcher implements AlertDispatcher {

    private final PumpScreenerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    private static final String SEND_MESSAGE_PATH = "/bot%s/sendMessage";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter
            .ofPattern("HH:mm")
            .withZone(ZoneId.of("UTC"));

    @PostConstruct
    public void init() {
        if (properties.getTelegram().isEnabled()) {
            log.info("Telegram notifications enabled for {} chat(s)", properties.getTelegram().getChatIds().size());
        } else {
            log.warn("Telegram notifications disabled, alerts will only be logged");
        }
    }

    @Override
    public void deliver(Alert alert) throws AlertDeliveryException {
        String message = formatAlertMessage(alert);

        if (!properties.getTelegram().isEnabled()) {
            log.info("Alert (telegram disabled): {}", message.replace('\n', ' '));
            return;
        }

        List<String> failedChats = new ArrayList<>();
        AlertDeliveryException lastError = null;
        for (String chatId : properties.getTelegram().getChatIds()) {
            if (chatId == null || chatId.isBlank()) {
                continue;
            }
            try {
                send(chatId.trim(), message);
            } catch (AlertDeliveryException e) {
                failedChats.add(chatId.trim());
                lastError = e;
            }
        }

        if (lastError != null) {
            throw new AlertDeliveryException(String.format("Failed to deliver %s %s to chats %s",
                    alert.signalType(), alert.symbol(), failedChats), lastError);
        }
        log.info("Sent signal: {} {} {}%", alert.signalType(), alert.symbol(),
                alert.percentChange().setScale(2, RoundingMode.HALF_UP).toPlainString());
    }

    String formatAlertMessage(Alert alert) {
        StringBuilder sb = new StringBuilder();

        sb.append(alert.signalType().getEmoji()).append(" *")
                .append(alert.signalType().getDisplayName()).append(": ")
                .append(alert.percentChange().abs().setScale(2, RoundingMode.HALF_UP).toPlainString())
                .append("%* (").append(escapeMarkdown(alert.symbol())).append(")\n");

        sb.append("📊 Volume: $").append(formatCurrency(alert.volume())).append("\n");

        sb.append("⏱️ ").append(TIME_FORMATTER.format(alert.timestamp())).append(" UTC");

        return sb.toString();
    }

    private void send(String chatId, String text) throws AlertDeliveryException {
        String url = properties.getTelegram().getApiUrl()
                + String.format(SEND_MESSAGE_PATH, properties.getTelegram().getBotToken());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", "Markdown");
        payload.put("disable_web_page_preview", true);

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AlertDeliveryException("Failed to serialise Telegram message", e);
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody body = response.body();
                throw new AlertDeliveryException(String.format("Telegram responded %d: %s",
                        response.code(), body != null ? body.string() : "no body"));
            }
        } catch (IOException e) {
            throw new AlertDeliveryException("Error sending Telegram message: " + e.getMessage(), e);
        }
    }

    private String formatCurrency(BigDecimal value) {
        return NumberFormat.getNumberInstance(Locale.US).format(value.setScale(0, RoundingMode.HALF_UP));
    }

    private String escapeMarkdown(String text) {
        return text
                .replace("_", "\\_")
                .replace("*", "\\*")
                .replace("[", "\\[")
                .replace("`", "\\`");
    }
}
