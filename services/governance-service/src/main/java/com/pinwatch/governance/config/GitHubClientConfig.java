package com.pinwatch.governance.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class GitHubClientConfig {

    @Bean
    @Qualifier("githubWebClient")
    WebClient githubWebClient(GovernanceProperties properties) {
        int maxBytes = Math.max(1, properties.getMaxInMemoryMb()) * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
        return WebClient.builder()
            .baseUrl(properties.getGithubApiUrl())
            .defaultHeader("User-Agent", properties.getUserAgent())
            .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
            .exchangeStrategies(strategies)
            .build();
    }
}
