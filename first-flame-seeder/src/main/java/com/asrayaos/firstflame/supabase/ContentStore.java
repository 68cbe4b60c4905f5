package com.asrayaos.firstflame.supabase;

/**
 * Read access to the bucket holding the static day-definition files.
 */
public interface ContentStore {

    /**
     * @param key the object key, e.g. {@code 5-day/day-1.json}
     * @return the object bytes
     * @throws SupabaseException if the object is missing or cannot be read
     */
    byte[] fetch(String key) throws SupabaseException;
}
