package com.gnovoa.reminders.jobs;

/** Internal invariant violation, e.g. a reminder scheduled twice under the same name. */
public class SchedulerFaultException extends IllegalStateException {

    public SchedulerFaultException(String message) {
        super(message);
    }
}
