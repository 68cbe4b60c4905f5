package com.asrayaos.firstflame.config;

import java.util.Locale;

/**
 * Selects how participant state is written to the store.
 */
public enum ParticipantMode {
    /**
     * Two client-side upserts: the participant row, then the progress row.
     */
    UPSERTS("upserts"),

    /**
     * One call to the {@code ensure_first_flame} stored procedure.
     */
    RPC("rpc");

    private final String value;

    ParticipantMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ParticipantMode fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ParticipantMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new ConfigurationException("Unknown participant mode: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
