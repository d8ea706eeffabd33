package com.gnovoa.reminders.api.dto;

import java.time.Instant;

public record ActiveJobResponse(
        String name,
        String kind,
        Instant nextFireAt,
        Reminder reminder
) {
    public record Reminder(long fixtureId, int offsetMinutes, String home, String away, String league, Instant kickoff) {}
}
