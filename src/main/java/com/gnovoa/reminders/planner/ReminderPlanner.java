package com.gnovoa.reminders.planner;

import com.gnovoa.reminders.model.Fixture;
import com.gnovoa.reminders.model.JobKey;
import com.gnovoa.reminders.model.PlannedReminder;
import com.gnovoa.reminders.model.ReminderPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps a fixture to the reminders still ahead of {@code now}.
 *
 * <p>Stateless; deduplication across pulls is the caller's concern (see {@link DedupLedger}).
 */
public final class ReminderPlanner {

    private static final Logger log = LoggerFactory.getLogger(ReminderPlanner.class);

    /**
     * Plans reminders for one fixture.
     *
     * @param fixture fixture as fetched; malformed records yield an empty list
     * @param now current instant
     * @param offsets minutes before kickoff, processed in order
     * @return reminders whose delivery instant is strictly after {@code now}, in offset order
     */
    public List<PlannedReminder> plan(Fixture fixture, Instant now, List<Integer> offsets) {
        try {
            requireComplete(fixture);
        } catch (MalformedFixtureException e) {
            log.debug("Skipping fixture: {}", e.getMessage());
            return List.of();
        }

        Instant kickoff = fixture.kickoff();
        if (!kickoff.isAfter(now)) return List.of();

        List<PlannedReminder> out = new ArrayList<>();
        for (int m : offsets) {
            Instant deliverAt = kickoff.minus(Duration.ofMinutes(m));
            if (!deliverAt.isAfter(now)) continue;

            var payload = new ReminderPayload(
                    fixture.id(), m, fixture.home(), fixture.away(), fixture.league(), kickoff);
            out.add(new PlannedReminder(deliverAt, new JobKey(fixture.id(), m), payload));
        }
        return out;
    }

    private static void requireComplete(Fixture fixture) {
        if (fixture == null) throw new MalformedFixtureException("null fixture record");
        if (!fixture.isComplete()) throw new MalformedFixtureException("incomplete fixture " + fixture);
    }
}
