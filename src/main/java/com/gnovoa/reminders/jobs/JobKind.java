package com.gnovoa.reminders.jobs;

public enum JobKind {
    REMINDER,
    ONE_SHOT,
    DAILY
}
