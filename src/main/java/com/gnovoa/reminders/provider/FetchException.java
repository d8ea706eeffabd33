package com.gnovoa.reminders.provider;

/** A call to the football data provider failed or timed out. */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
