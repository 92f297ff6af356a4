package com.rostra.eventtransport.config;

import java.util.Locale;

/** Where the streaming engine runs. */
public enum TransportMode {
    /** In-process engine owned by the application. */
    EMBEDDED,
    /** External broker reached over the network. */
    REMOTE;

    /**
     * Parses a mode name, ignoring case.
     *
     * @throws IllegalArgumentException for anything but "embedded" or "remote"
     */
    public static TransportMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("transport mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "unknown transport mode '" + value + "', expected embedded or remote", e);
        }
    }
}
