package com.bybot.backend.service.notification;

import com.bybot.backend.config.TelegramProperties;
import com.bybot.backend.service.failover.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Sends failover messages to a Telegram chat through the Bot API.
 */
@Slf4j
public class TelegramNotifier implements Notifier {

    private final RestTemplate restTemplate;
    private final TelegramProperties properties;

    public TelegramNotifier(RestTemplate restTemplate, TelegramProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        if (properties.isEnabled() && !properties.isConfigured()) {
            log.warn("Telegram notifications enabled but bot token or chat id missing (TELEGRAM_BOT_TOKEN, TELEGRAM_CHAT_ID)");
        }
    }

    @Override
    public void sendMessage(String message) {
        if (!properties.isEnabled() || !properties.isConfigured()) {
            log.debug("Telegram disabled, dropping message: {}", message);
            return;
        }
        String url = properties.getApiUrl() + "/bot" + properties.getBotToken() + "/sendMessage";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = Map.of("chat_id", properties.getChatId(), "text", message);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            log.error("Error sending Telegram notification: {}", e.getMessage());
        }
    }
}
