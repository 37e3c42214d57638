package com.pinwatch.governance.store;

public record RunFilter(String repository, String branch) {

    public RunFilter {
        repository = blankToNull(repository);
        branch = blankToNull(branch);
    }

    public static RunFilter none() {
        return new RunFilter(null, null);
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
