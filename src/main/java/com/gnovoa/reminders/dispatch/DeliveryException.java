package com.gnovoa.reminders.dispatch;

/** A message could not be delivered to one destination. */
public class DeliveryException extends RuntimeException {

    private final long destination;

    public DeliveryException(long destination, String message, Throwable cause) {
        super(String.format("[%d] %s", destination, message), cause);
        this.destination = destination;
    }

    public long getDestination() {
        return destination;
    }
}
