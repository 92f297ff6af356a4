package com.rostra.eventbus;

/**
 * Signals that a subscription fell behind and envelopes were discarded since the last receive.
 *
 * <p>Raised once per gap; the following receive continues with the oldest retained envelope.
 */
public class SubscriptionLaggedException extends Exception {

    private final String subscriber;
    private final long missed;

    public SubscriptionLaggedException(String subscriber, long missed) {
        super("subscriber '" + subscriber + "' lagged, " + missed + " event(s) dropped");
        this.subscriber = subscriber;
        this.missed = missed;
    }

    public String subscriber() {
        return subscriber;
    }

    /** Number of envelopes dropped since the previous receive. */
    public long missed() {
        return missed;
    }
}
