package com.gnovoa.reminders.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * A single match as fetched from the data provider.
 *
 * <p>Fields are nullable: provider records missing a field are still mapped, and rejected later
 * by {@link #isComplete()} checks.
 */
public record Fixture(Long id, Instant kickoff, String home, String away, String league) {

    public boolean isComplete() {
        return id != null
                && kickoff != null
                && home != null && !home.isBlank()
                && away != null && !away.isBlank()
                && league != null;
    }

    /** Calendar date of the kickoff in {@code zone}, or null when the kickoff is unknown. */
    public LocalDate kickoffDate(ZoneId zone) {
        return kickoff == null ? null : LocalDate.ofInstant(kickoff, zone);
    }
}
