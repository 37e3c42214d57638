package com.pinwatch.governance.stats;

public record RepositoryStats(String repository, long runs, long findings) {
}
