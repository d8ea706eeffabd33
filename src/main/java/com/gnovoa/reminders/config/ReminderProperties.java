package com.gnovoa.reminders.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scheduling settings under {@code reminders.*}.
 *
 * <p>Invalid values fail application startup.
 *
 * @param timezone reference zone for "today", "now" and displayed kickoff times
 * @param countries tracked countries, in the order they are processed
 * @param offsets minutes before kickoff at which reminders fire; 0 means at kickoff
 * @param dailyPullTime local time (reference zone) of the daily pull, {@code HH:mm}
 * @param bootPullDelay delay between startup and the safety-net pull
 * @param bootPullEnabled whether the boot pull is registered at startup
 * @param dailyPullOnBoot whether the daily pull is enabled at startup
 */
@ConfigurationProperties(prefix = "reminders")
public record ReminderProperties(
    String timezone,
    List<String> countries,
    List<Integer> offsets,
    String dailyPullTime,
    Duration bootPullDelay,
    boolean bootPullEnabled,
    boolean dailyPullOnBoot) {

  public ReminderProperties {
    if (timezone == null || timezone.isBlank()) timezone = "Asia/Dubai";
    ZoneId.of(timezone);
    if (countries == null || countries.isEmpty()) {
      throw new IllegalArgumentException("reminders.countries must list at least one country");
    }
    countries = List.copyOf(countries);
    if (offsets == null || offsets.isEmpty()) offsets = List.of(60, 15, 0);
    for (Integer m : offsets) {
      if (m == null || m < 0) {
        throw new IllegalArgumentException("reminders.offsets must be non-negative, got " + m);
      }
    }
    offsets = List.copyOf(offsets);
    if (dailyPullTime == null || dailyPullTime.isBlank()) dailyPullTime = "09:00";
    LocalTime.parse(dailyPullTime);
    if (bootPullDelay == null) bootPullDelay = Duration.ofSeconds(5);
  }

  public ZoneId zone() {
    return ZoneId.of(timezone);
  }

  public LocalTime dailyPullLocalTime() {
    return LocalTime.parse(dailyPullTime);
  }
}
