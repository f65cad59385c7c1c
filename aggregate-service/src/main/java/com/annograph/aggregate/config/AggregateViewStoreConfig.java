package com.annograph.aggregate.config;

import com.annograph.aggregate.view.AggregateViewStore;
import com.annograph.aggregate.view.InMemoryAggregateViewStore;
import com.annograph.aggregate.view.JdbcAggregateViewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class AggregateViewStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(AggregateViewStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "annograph.aggregate.view-store", havingValue = "jdbc", matchIfMissing = true)
    public AggregateViewStore jdbcAggregateViewStore(JdbcTemplate jdbcTemplate) {
        log.info("aggregate view store initialized backend=jdbc");
        return new JdbcAggregateViewStore(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "annograph.aggregate.view-store", havingValue = "memory")
    public AggregateViewStore inMemoryAggregateViewStore() {
        log.warn("aggregate view store initialized backend=memory; the view is not shared between instances");
        return new InMemoryAggregateViewStore();
    }
}
