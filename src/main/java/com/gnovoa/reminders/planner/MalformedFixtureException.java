package com.gnovoa.reminders.planner;

/** A provider fixture record is missing a field required to plan reminders. */
public class MalformedFixtureException extends RuntimeException {

    public MalformedFixtureException(String message) {
        super(message);
    }
}
