package com.pinwatch.governance.client;

public record CheckRunSummary(String name, String conclusion, String title, String summary) {
}
