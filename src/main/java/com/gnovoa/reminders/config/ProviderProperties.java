package com.gnovoa.reminders.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Football data provider (API-Football v3) connection settings. */
@ConfigurationProperties(prefix = "provider")
public record ProviderProperties(String baseUrl, String apiKey, Duration timeout) {
  public ProviderProperties {
    if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://v3.football.api-sports.io";
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("provider.api-key is required (APIFOOTBALL_KEY)");
    }
    if (timeout == null) timeout = Duration.ofSeconds(25);
  }
}
