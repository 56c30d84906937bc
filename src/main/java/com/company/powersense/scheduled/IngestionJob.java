package com.company.powersense.scheduled;

import com.company.powersense.domain.CycleResult;
import com.company.powersense.service.IngestionCycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Real-time ingestion, every 5 minutes by default. Fixed delay: a pass never overlaps the previous one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "powersense.ingestion.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class IngestionJob {

    static final String MDC_CYCLE_ID_KEY = "cycleId";

    private final IngestionCycleService ingestionCycleService;

    @Scheduled(
            fixedDelayString = "${powersense.ingestion.interval:PT5M}",
            initialDelayString = "${powersense.ingestion.initial-delay:PT20S}"
    )
    public void ingest() {
        MDC.put(MDC_CYCLE_ID_KEY, "ingest-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            CycleResult result = ingestionCycleService.runCycle();
            if (!result.isSuccess()) {
                log.warn("Ingestion pass failed after writing {} rows; next pass in the regular schedule",
                        result.rowsWritten());
            }
        } catch (Exception e) {
            log.error("Ingestion job failed", e);
        } finally {
            MDC.remove(MDC_CYCLE_ID_KEY);
        }
    }
}
