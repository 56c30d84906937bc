package com.company.powersense.controller;

import com.company.powersense.domain.enums.SortOrder;
import com.company.powersense.dto.response.AnomalyResponse;
import com.company.powersense.repository.TimeSeriesQuery;
import com.company.powersense.service.MeasurementQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Flagged baseline deviations")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class AnomalyController {

    private final MeasurementQueryService queryService;

    @GetMapping
    @Operation(summary = "Anomaly history", description = "Filtered by inclusive time range, source and metric")
    @PreAuthorize("hasAnyRole('READER', 'ADMIN')")
    public ResponseEntity<List<AnomalyResponse>> getAnomalies(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String metric,
            @RequestParam(defaultValue = "100") @Min(1) @Max(5000) int limit,
            @Parameter(description = "asc or desc") @RequestParam(defaultValue = "desc") String order) {

        TimeSeriesQuery query = TimeSeriesQuery.builder()
                .start(start)
                .end(end)
                .source(source)
                .metric(metric)
                .limit(limit)
                .order(SortOrder.fromString(order))
                .build();

        return ResponseEntity.ok(queryService.findAnomalies(query));
    }
}
