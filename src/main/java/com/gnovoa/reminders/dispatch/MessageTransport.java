package com.gnovoa.reminders.dispatch;

public interface MessageTransport {

    /**
     * Sends {@code text} to a single destination.
     *
     * @throws DeliveryException if the send fails or times out
     */
    void deliver(long destination, String text);
}
