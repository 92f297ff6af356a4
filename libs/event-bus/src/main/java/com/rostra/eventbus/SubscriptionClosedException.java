package com.rostra.eventbus;

/** Thrown by {@link EventSubscription#receive()} once the subscription is closed and drained. */
public class SubscriptionClosedException extends IllegalStateException {

    public SubscriptionClosedException(String subscriber) {
        super("subscription '" + subscriber + "' is closed");
    }
}
