package com.gnovoa.reminders.jobs;

import com.gnovoa.reminders.model.ReminderPayload;

/** Callback invoked once per reminder job when it fires. */
@FunctionalInterface
public interface ReminderHandler {
    void onReminder(ReminderPayload payload);
}
