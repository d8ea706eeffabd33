package com.gnovoa.reminders.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReminderPropertiesTest {

  @Test
  void appliesDefaults() {
    var props = new ReminderProperties(null, List.of("Spain"), null, null, null, true, false);

    assertThat(props.zone()).isEqualTo(ZoneId.of("Asia/Dubai"));
    assertThat(props.offsets()).containsExactly(60, 15, 0);
    assertThat(props.dailyPullLocalTime()).isEqualTo(LocalTime.of(9, 0));
    assertThat(props.bootPullDelay()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void rejectsInvalidValues() {
    assertThatThrownBy(() -> new ReminderProperties("UTC", List.of(), null, null, null, true, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ReminderProperties("UTC", List.of("Spain"), List.of(15, -5), null, null, true, false))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("-5");
    assertThatThrownBy(() -> new ReminderProperties("Mars/Olympus", List.of("Spain"), null, null, null, true, false))
        .isInstanceOf(java.time.DateTimeException.class);
    assertThatThrownBy(() -> new ReminderProperties("UTC", List.of("Spain"), null, "25:99", null, true, false))
        .isInstanceOf(java.time.format.DateTimeParseException.class);
  }

  @Test
  void secretsAreRequired() {
    assertThatThrownBy(() -> new ProviderProperties(null, " ", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("APIFOOTBALL_KEY");
    assertThatThrownBy(() -> new TelegramProperties(null, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("BOT_TOKEN");
  }
}
