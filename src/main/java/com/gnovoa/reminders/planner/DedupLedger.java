package com.gnovoa.reminders.planner;

import com.gnovoa.reminders.model.JobKey;

/** Remembers which reminders have already been scheduled. */
public interface DedupLedger {

    /**
     * Atomically records {@code key} as taken.
     *
     * @return true if this call took the key, false if it was already taken
     */
    boolean reserve(JobKey key);

    boolean contains(JobKey key);

    int size();
}
