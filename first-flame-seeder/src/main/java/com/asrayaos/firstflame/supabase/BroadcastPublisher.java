package com.asrayaos.firstflame.supabase;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Publishes an event on a realtime broadcast channel.
 */
public interface BroadcastPublisher {

    void publish(String channel, String event, ObjectNode payload) throws SupabaseException;
}
