package com.pinwatch.governance.domain;

import java.util.Locale;

public enum EventKind {
    PUSH("push"),
    PULL_REQUEST("pull_request"),
    OTHER("other");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EventKind fromHeader(String header) {
        if (header == null) {
            return OTHER;
        }
        String normalized = header.trim().toLowerCase(Locale.ROOT);
        for (EventKind kind : values()) {
            if (kind != OTHER && kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }
}
