package com.rostra.eventbus;

/** Thrown by {@link EventBus#publish} and {@link EventBus#subscribe()} after the bus is closed. */
public class EventBusClosedException extends IllegalStateException {

    public EventBusClosedException() {
        super("event bus is closed");
    }
}
