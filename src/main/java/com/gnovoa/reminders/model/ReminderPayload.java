package com.gnovoa.reminders.model;

import java.time.Instant;

/** Everything needed to format a reminder when it fires. */
public record ReminderPayload(
        long fixtureId,
        int offsetMinutes,
        String home,
        String away,
        String league,
        Instant kickoff
) {}
