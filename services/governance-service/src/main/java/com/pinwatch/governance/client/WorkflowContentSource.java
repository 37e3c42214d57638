package com.pinwatch.governance.client;

import com.pinwatch.governance.domain.ChangedFile;
import java.util.List;
import java.util.Optional;

public interface WorkflowContentSource {

    /**
     * @return file content at {@code ref}, or empty when the file does not exist there
     * @throws ContentFetchException on transport errors, timeouts and unexpected statuses
     */
    Optional<String> fetchFile(String repository, String ref, String path);

    /**
     * @throws ContentFetchException when the file list cannot be retrieved
     */
    List<ChangedFile> listPullRequestFiles(String repository, int pullRequestNumber);
}
