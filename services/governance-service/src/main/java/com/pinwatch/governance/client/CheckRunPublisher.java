package com.pinwatch.governance.client;

public interface CheckRunPublisher {

    void publish(String repository, String headSha, CheckRunSummary summary);
}
