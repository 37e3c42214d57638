package com.pinwatch.governance.config;

import com.pinwatch.governance.stats.StatsCache;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CoreConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StatsCache statsCache(GovernanceProperties properties, MeterRegistry meterRegistry) {
        return new StatsCache(properties.getStatsCacheTtl(), meterRegistry);
    }
}
