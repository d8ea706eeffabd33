package com.gnovoa.reminders.dispatch;

import com.gnovoa.reminders.jobs.ReminderHandler;
import com.gnovoa.reminders.model.ReminderPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fired reminders go to whoever is subscribed at that moment. */
public final class ReminderDelivery implements ReminderHandler {

    private static final Logger log = LoggerFactory.getLogger(ReminderDelivery.class);

    private final SubscriptionRegistry subscriptions;
    private final BroadcastDispatcher dispatcher;
    private final ReminderMessageFormatter formatter;

    public ReminderDelivery(SubscriptionRegistry subscriptions, BroadcastDispatcher dispatcher, ReminderMessageFormatter formatter) {
        this.subscriptions = subscriptions;
        this.dispatcher = dispatcher;
        this.formatter = formatter;
    }

    @Override
    public void onReminder(ReminderPayload payload) {
        var recipients = subscriptions.snapshot();
        if (recipients.isEmpty()) {
            log.debug("No subscribers for reminder {}:{}", payload.fixtureId(), payload.offsetMinutes());
            return;
        }
        BroadcastResult result = dispatcher.broadcast(formatter.format(payload), recipients);
        log.info("Reminder {}:{} ({} vs {}) delivered={} failed={}",
                payload.fixtureId(), payload.offsetMinutes(), payload.home(), payload.away(),
                result.delivered(), result.failed());
    }
}
