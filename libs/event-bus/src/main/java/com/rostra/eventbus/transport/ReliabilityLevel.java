package com.rostra.eventbus.transport;

/** Delivery guarantee offered by an {@link EventTransport}. */
public enum ReliabilityLevel {
    /** Fire and forget; nothing survives the process. */
    NONE,
    /** Appended to a durable, replayable stream. */
    STREAMING
}
