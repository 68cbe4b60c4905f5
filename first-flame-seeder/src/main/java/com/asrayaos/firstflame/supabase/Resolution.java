package com.asrayaos.firstflame.supabase;

/**
 * How PostgREST resolves an insert that hits the {@code on_conflict} constraint.
 */
public enum Resolution {
    /**
     * Update the existing row with the supplied values.
     */
    MERGE_DUPLICATES("resolution=merge-duplicates"),

    /**
     * Keep the existing row untouched; only missing rows are inserted.
     */
    IGNORE_DUPLICATES("resolution=ignore-duplicates");

    private final String preference;

    Resolution(String preference) {
        this.preference = preference;
    }

    public String getPreference() {
        return preference;
    }
}
