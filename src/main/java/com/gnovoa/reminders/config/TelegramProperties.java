package com.gnovoa.reminders.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "telegram")
public record TelegramProperties(String baseUrl, String botToken, Duration timeout) {
  public TelegramProperties {
    if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.telegram.org";
    if (botToken == null || botToken.isBlank()) {
      throw new IllegalArgumentException("telegram.bot-token is required (BOT_TOKEN)");
    }
    if (timeout == null) timeout = Duration.ofSeconds(10);
  }
}
