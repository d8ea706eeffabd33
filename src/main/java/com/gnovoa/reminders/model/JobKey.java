package com.gnovoa.reminders.model;

/** Identifies one reminder: a fixture and a minutes-before-kickoff offset. */
public record JobKey(long fixtureId, int offsetMinutes) {

    /** Name under which the reminder job is registered with the scheduler. */
    public String jobName() {
        return "fx:" + fixtureId + ":" + offsetMinutes;
    }

    @Override
    public String toString() {
        return fixtureId + ":" + offsetMinutes;
    }
}
