package com.bybot.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "bybot.telegram")
@Data
public class TelegramProperties {

    private boolean enabled = false;
    private String botToken = "";
    private String chatId = "";
    private String apiUrl = "https://api.telegram.org";

    public boolean isConfigured() {
        return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }
}
