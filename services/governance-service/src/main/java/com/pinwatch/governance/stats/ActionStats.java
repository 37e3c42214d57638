package com.pinwatch.governance.stats;

public record ActionStats(String actionId, long occurrences, long pinned, long unpinned) {
}
