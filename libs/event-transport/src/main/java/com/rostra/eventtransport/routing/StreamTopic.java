package com.rostra.eventtransport.routing;

/** Logical topics of a stream. */
public enum StreamTopic {
    /** Tenant business facts. */
    DOMAIN("domain"),
    /** Platform facts ({@code system.*} event types). */
    SYSTEM("system");

    private final String value;

    StreamTopic(String value) {
        this.value = value;
    }

    /** Logical name, also used as the metric label. */
    public String value() {
        return value;
    }

    /** Broker-level topic name, {@code <stream>.<topic>}. */
    public String physicalName(String stream) {
        return stream + "." + value;
    }
}
