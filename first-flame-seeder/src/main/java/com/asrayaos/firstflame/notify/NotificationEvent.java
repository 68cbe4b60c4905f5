package com.asrayaos.firstflame.notify;

/**
 * Events published on the First-Flame status channel.
 */
public enum NotificationEvent {
    READY("ready"),
    ERROR("error");

    private final String wireName;

    NotificationEvent(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
