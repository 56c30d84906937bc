package com.company.powersense.config;

import com.company.powersense.ingest.versioning.ContentHashVersioningStrategy;
import com.company.powersense.ingest.versioning.SequentialVersioningStrategy;
import com.company.powersense.ingest.versioning.VersioningStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class VersioningConfiguration {

    @Bean
    public VersioningStrategy versioningStrategy(PowerSenseProperties properties) {
        VersioningStrategy strategy = switch (properties.getIngestion().getVersioningMode()) {
            case SEQUENTIAL -> new SequentialVersioningStrategy();
            case CONTENT_HASH -> new ContentHashVersioningStrategy();
        };
        log.info("Measurement versioning mode: {} ({})",
                strategy.mode(), strategy.mode().getDescription());
        return strategy;
    }
}
