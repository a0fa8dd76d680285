package com.catalogizer.core.events;

public enum SourceEventType {

    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    RECONNECTING("reconnecting"),
    OFFLINE("offline"),
    FILE_CHANGE("file_change"),
    ERROR("error"),
    HEALTH_CHECK("health_check");

    private final String wireName;

    SourceEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
