package com.chatrelay.coordinator.chat.api;

public enum PresenceState {
    ONLINE("online"),
    AWAY("away"),
    OFFLINE("offline");

    private final String wireName;

    PresenceState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
