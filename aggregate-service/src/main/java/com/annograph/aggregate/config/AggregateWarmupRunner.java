package com.annograph.aggregate.config;

import com.annograph.aggregate.AggregateViewManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class AggregateWarmupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AggregateWarmupRunner.class);

    private final AggregateViewManager viewManager;
    private final boolean warmupEnabled;

    public AggregateWarmupRunner(
            AggregateViewManager viewManager,
            @Value("${annograph.aggregate.warmup.enabled:true}") boolean warmupEnabled
    ) {
        this.viewManager = viewManager;
        this.warmupEnabled = warmupEnabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!warmupEnabled) {
            return;
        }
        boolean scheduled = viewManager.refresh("startup");
        log.info("aggregate warmup view={} refresh_scheduled={}", AggregateViewManager.VIEW_NAME, scheduled);
    }
}
