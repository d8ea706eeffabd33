package com.gnovoa.reminders.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/** Sends one message to many destinations, isolating per-destination failures. */
public final class BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final MessageTransport transport;

    public BroadcastDispatcher(MessageTransport transport) {
        this.transport = transport;
    }

    /** Never throws; failures are logged and counted. */
    public BroadcastResult broadcast(String message, Collection<Long> destinations) {
        int delivered = 0;
        int failed = 0;
        for (long destination : List.copyOf(destinations)) {
            try {
                transport.deliver(destination, message);
                delivered++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Broadcast to {} failed: {}", destination, e.getMessage());
            }
        }
        return new BroadcastResult(delivered, failed);
    }
}
