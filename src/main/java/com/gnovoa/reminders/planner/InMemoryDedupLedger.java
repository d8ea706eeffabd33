package com.gnovoa.reminders.planner;

import com.gnovoa.reminders.model.JobKey;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Process-lifetime ledger. Keys are never evicted. */
public final class InMemoryDedupLedger implements DedupLedger {

    private final Set<JobKey> keys = ConcurrentHashMap.newKeySet();

    @Override
    public boolean reserve(JobKey key) {
        return keys.add(key);
    }

    @Override
    public boolean contains(JobKey key) {
        return keys.contains(key);
    }

    @Override
    public int size() {
        return keys.size();
    }
}
