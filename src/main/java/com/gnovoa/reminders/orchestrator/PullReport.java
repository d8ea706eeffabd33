package com.gnovoa.reminders.orchestrator;

import java.time.LocalDate;

/** Outcome of one pull cycle. Partial failures still produce a report. */
public record PullReport(
        LocalDate date,
        int countries,
        int leaguesFetched,
        int leaguesFailed,
        int jobsScheduled,
        boolean summaryBroadcast
) {}
