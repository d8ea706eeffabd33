package com.gnovoa.reminders.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Chat ids opted in to reminders. */
public final class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Set<Long> subscribers = ConcurrentHashMap.newKeySet();

    public boolean subscribe(long chatId) {
        boolean added = subscribers.add(chatId);
        if (added) log.info("Subscribed {}", chatId);
        return added;
    }

    public boolean unsubscribe(long chatId) {
        boolean removed = subscribers.remove(chatId);
        if (removed) log.info("Unsubscribed {}", chatId);
        return removed;
    }

    /** Point-in-time copy, safe to iterate while others subscribe or unsubscribe. */
    public List<Long> snapshot() {
        return List.copyOf(new TreeSet<>(subscribers));
    }

    public boolean isEmpty() {
        return subscribers.isEmpty();
    }

    public int size() {
        return subscribers.size();
    }
}
