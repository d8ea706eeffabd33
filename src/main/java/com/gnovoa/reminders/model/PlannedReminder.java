package com.gnovoa.reminders.model;

import java.time.Instant;

public record PlannedReminder(Instant deliverAt, JobKey key, ReminderPayload payload) {}
