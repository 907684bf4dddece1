package com.comanda.eventstore;

/** Base class for failures raised by an {@link EventStore}. */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
