package com.annograph.query.controller;

import com.annograph.aggregate.AggregateViewManager;
import com.annograph.aggregate.staleness.StalenessMonitor;
import com.annograph.aggregate.staleness.StalenessReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/aggregates")
public class AggregateController {

    private final AggregateViewManager aggregateViewManager;
    private final StalenessMonitor stalenessMonitor;

    public AggregateController(AggregateViewManager aggregateViewManager, StalenessMonitor stalenessMonitor) {
        this.aggregateViewManager = aggregateViewManager;
        this.stalenessMonitor = stalenessMonitor;
    }

    @PostMapping("/refresh")
    public Map<String, Object> refresh(@RequestParam(value = "reason", defaultValue = "manual") String reason) {
        boolean scheduled = aggregateViewManager.refresh(reason);
        return Map.of("view", AggregateViewManager.VIEW_NAME, "scheduled", scheduled);
    }

    @GetMapping("/staleness")
    public List<StalenessReport> staleness() {
        return stalenessMonitor.report();
    }
}
