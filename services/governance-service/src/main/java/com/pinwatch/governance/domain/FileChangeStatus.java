package com.pinwatch.governance.domain;

import java.util.Locale;

public enum FileChangeStatus {
    ADDED,
    MODIFIED,
    REMOVED;

    public boolean isPresentAfterChange() {
        return this != REMOVED;
    }

    /**
     * Maps the status strings of the pull request files API. Renames, copies and plain changes
     * all leave a file at the new path.
     */
    public static FileChangeStatus fromApiStatus(String status) {
        String normalized = status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "added" -> ADDED;
            case "removed" -> REMOVED;
            default -> MODIFIED;
        };
    }
}
