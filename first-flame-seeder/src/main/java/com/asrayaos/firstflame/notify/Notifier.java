package com.asrayaos.firstflame.notify;

import com.asrayaos.firstflame.supabase.BroadcastPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tells a live client that a user's ritual state is ready, or that seeding failed.
 *
 * <p>Delivery is best-effort: a failed publish is logged and dropped, and never reaches the
 * caller, so it can neither mask the run's outcome nor trigger a retry of completed writes.
 */
public class Notifier {
    private static final Logger logger = LoggerFactory.getLogger(Notifier.class);

    private final BroadcastPublisher publisher;
    private final ObjectMapper objectMapper;
    private final String channel;

    public Notifier(BroadcastPublisher publisher, ObjectMapper objectMapper, String channel) {
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    /**
     * Publishes {@code {user_id, detail?}} on the status channel.
     *
     * @param userId the user the event is about
     * @param event  ready or error
     * @param detail optional detail, e.g. the failure reason; omitted when {@code null}
     * @return whether the publish call succeeded
     */
    public boolean notify(String userId, NotificationEvent event, String detail) {
        ObjectNode payload = objectMapper.createObjectNode().put("user_id", userId);
        if (detail != null) {
            payload.put("detail", detail);
        }
        try {
            publisher.publish(channel, event.getWireName(), payload);
            logger.debug("Published '{}' on {} for user {}", event, channel, userId);
            return true;
        } catch (Exception e) {
            logger.warn("Could not publish '{}' on {} for user {}: {}", event, channel, userId, e.getMessage());
            return false;
        }
    }

    public String getChannel() {
        return channel;
    }
}
