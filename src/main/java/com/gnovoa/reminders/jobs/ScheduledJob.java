package com.gnovoa.reminders.jobs;

import com.gnovoa.reminders.model.ReminderPayload;

import java.time.Instant;

/**
 * Read-only view of an active job.
 *
 * @param payload reminder data, null for non-reminder jobs
 */
public record ScheduledJob(
        long id,
        String name,
        JobKind kind,
        Instant nextFireAt,
        ReminderPayload payload
) {}
