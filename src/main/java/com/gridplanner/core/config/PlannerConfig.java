package com.gridplanner.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the category catalog once at start-up so every layout run shares the same table.
 */
@Configuration
public class PlannerConfig {

    private static final Logger log = LoggerFactory.getLogger(PlannerConfig.class);

    @Bean
    public CategoryCatalog categoryCatalog(PlannerProperties properties) {
        CategoryCatalog catalog = properties.toCategoryCatalog();
        log.info("Loaded {} task categories", catalog.all().size());
        return catalog;
    }
}
