package com.company.powersense.scheduled;

import com.company.powersense.domain.CycleResult;
import com.company.powersense.service.AnomalyDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "powersense.anomaly.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AnomalyDetectionJob {

    private final AnomalyDetectionService anomalyDetectionService;

    /**
     * Every 15 minutes by default
     */
    @Scheduled(
            fixedDelayString = "${powersense.anomaly.interval:PT15M}",
            initialDelayString = "${powersense.anomaly.initial-delay:PT1M}"
    )
    public void detect() {
        MDC.put(IngestionJob.MDC_CYCLE_ID_KEY, "anomaly-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            CycleResult result = anomalyDetectionService.runCycle();
            if (!result.isSuccess()) {
                log.warn("Anomaly detection pass failed in {}ms", result.duration().toMillis());
            }
        } catch (Exception e) {
            log.error("Anomaly detection job failed", e);
        } finally {
            MDC.remove(IngestionJob.MDC_CYCLE_ID_KEY);
        }
    }
}
