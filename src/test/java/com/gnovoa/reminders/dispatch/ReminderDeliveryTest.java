package com.gnovoa.reminders.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.reminders.model.ReminderPayload;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReminderDeliveryTest {

  private static final ZoneId DUBAI = ZoneId.of("Asia/Dubai");

  private final List<String> sent = new ArrayList<>();
  private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();
  private final ReminderMessageFormatter formatter = new ReminderMessageFormatter(DUBAI);
  private final ReminderDelivery delivery = new ReminderDelivery(
      subscriptions,
      new BroadcastDispatcher((destination, text) -> sent.add(destination + "|" + text)),
      formatter);

  private final ReminderPayload payload = new ReminderPayload(
      11, 15, "Arsenal", "Chelsea", "Premier League",
      ZonedDateTime.of(2026, 10, 19, 19, 30, 0, 0, DUBAI).toInstant());

  @Test
  void subscribersAreReadWhenTheReminderFires() {
    subscriptions.subscribe(100);
    // joins after scheduling, before firing
    subscriptions.subscribe(200);
    subscriptions.unsubscribe(100);

    delivery.onReminder(payload);

    assertThat(sent).singleElement().satisfies(s -> assertThat(s).startsWith("200|"));
  }

  @Test
  void formatsTeamsKickoffAndLabel() {
    String text = formatter.format(payload);

    assertThat(text).contains("Kick-off in 15 minutes", "Arsenal vs Chelsea", "7:30 PM", "Premier League");
    assertThat(ReminderMessageFormatter.label(60)).isEqualTo("Kick-off in 1 hour");
    assertThat(ReminderMessageFormatter.label(0)).isEqualTo("Kick-off now");
  }

  @Test
  void noSubscribersNoSend() {
    delivery.onReminder(payload);

    assertThat(sent).isEmpty();
  }
}
