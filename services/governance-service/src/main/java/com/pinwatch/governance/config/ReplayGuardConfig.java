package com.pinwatch.governance.config;

import com.pinwatch.governance.replay.InMemoryReplayGuard;
import com.pinwatch.governance.replay.JdbcReplayGuard;
import com.pinwatch.governance.replay.ReplayBackend;
import com.pinwatch.governance.replay.ReplayGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class ReplayGuardConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplayGuardConfig.class);

    @Bean
    ReplayGuard replayGuard(GovernanceProperties properties, JdbcTemplate jdbcTemplate) {
        if (properties.getReplayBackend() == ReplayBackend.SHARED) {
            LOGGER.info("Using shared replay guard, window {}, pending lease {}, failure policy {}",
                properties.getReplayWindow(), properties.getReplayPendingLease(), properties.getReplayFailurePolicy());
            return new JdbcReplayGuard(
                jdbcTemplate,
                properties.getReplayWindow(),
                properties.getReplayPendingLease(),
                properties.getReplayFailurePolicy()
            );
        }
        LOGGER.info("Using in-process replay guard, window {}, pending lease {}",
            properties.getReplayWindow(), properties.getReplayPendingLease());
        return new InMemoryReplayGuard(properties.getReplayWindow(), properties.getReplayPendingLease());
    }
}
