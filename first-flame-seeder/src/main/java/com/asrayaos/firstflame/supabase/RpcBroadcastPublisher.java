package com.asrayaos.firstflame.supabase;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@link BroadcastPublisher} going through the database's {@code broadcast} function,
 * which forwards the message to Realtime.
 */
public class RpcBroadcastPublisher implements BroadcastPublisher {

    static final String BROADCAST_FN = "broadcast";
    static final String BROADCAST_SCHEMA = "public";

    private final SupabaseClient client;

    public RpcBroadcastPublisher(SupabaseClient client) {
        this.client = client;
    }

    @Override
    public void publish(String channel, String event, ObjectNode payload) throws SupabaseException {
        ObjectNode args = client.getObjectMapper().createObjectNode()
            .put("channel", channel)
            .put("event", event);
        args.set("payload", payload);
        client.rpc(BROADCAST_SCHEMA, BROADCAST_FN, args);
    }
}
