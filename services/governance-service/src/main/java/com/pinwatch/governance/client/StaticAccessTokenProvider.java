package com.pinwatch.governance.client;

import com.pinwatch.governance.config.GovernanceProperties;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Uses the single token from {@code governance.github-token}. Installation token exchange happens
 * outside this service; whatever performs it refreshes that property.
 */
@Component
public class StaticAccessTokenProvider implements AccessTokenProvider {

    private final GovernanceProperties properties;

    public StaticAccessTokenProvider(GovernanceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> tokenFor(String repository) {
        String token = properties.getGithubToken();
        return token == null || token.isBlank() ? Optional.empty() : Optional.of(token.trim());
    }
}
