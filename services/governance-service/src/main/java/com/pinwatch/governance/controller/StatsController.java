package com.pinwatch.governance.controller;

import com.pinwatch.governance.stats.StatsService;
import com.pinwatch.governance.stats.StatsSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/stats")
    public StatsSnapshot stats() {
        return statsService.getStats();
    }
}
