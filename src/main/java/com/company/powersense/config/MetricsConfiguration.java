package com.company.powersense.config;

import com.company.powersense.repository.MeasurementRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Store-level gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final MeasurementRepository measurementRepository;

    @Bean
    public MeterBinder measurementStoreMetrics() {
        return registry -> {
            Gauge.builder("powersense.measurements.rows", measurementRepository, repo -> {
                        try {
                            return repo.count();
                        } catch (Exception e) {
                            log.warn("Failed to count stored measurements", e);
                            return 0;
                        }
                    })
                    .description("Rows in the measurements table, all versions")
                    .register(registry);

            log.info("Store metrics registered");
        };
    }
}
