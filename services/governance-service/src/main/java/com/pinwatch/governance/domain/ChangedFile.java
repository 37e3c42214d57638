package com.pinwatch.governance.domain;

public record ChangedFile(String path, FileChangeStatus status) {
}
