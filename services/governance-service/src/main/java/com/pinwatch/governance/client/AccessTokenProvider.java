package com.pinwatch.governance.client;

import java.util.Optional;

/**
 * Source of the bearer token used for GitHub API calls on behalf of a repository.
 */
public interface AccessTokenProvider {

    Optional<String> tokenFor(String repository);
}
