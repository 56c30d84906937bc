package com.company.powersense.controller;

import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.enums.SortOrder;
import com.company.powersense.dto.request.IngestRequest;
import com.company.powersense.dto.request.MeasurementRow;
import com.company.powersense.dto.response.CountResponse;
import com.company.powersense.dto.response.IngestResponse;
import com.company.powersense.dto.response.MeasurementResponse;
import com.company.powersense.repository.TimeSeriesQuery;
import com.company.powersense.service.MeasurementIngestionService;
import com.company.powersense.service.MeasurementQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/measurements")
@Tag(name = "Measurements", description = "Query and push versioned measurements")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class MeasurementController {

    private final MeasurementQueryService queryService;
    private final MeasurementIngestionService ingestionService;

    @GetMapping
    @Operation(
            summary = "Raw measurement history",
            description = "Every stored version, filtered by inclusive time range, source, metric and identity key"
    )
    @PreAuthorize("hasAnyRole('READER', 'ADMIN')")
    public ResponseEntity<List<MeasurementResponse>> getMeasurements(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) String ukey,
            @RequestParam(defaultValue = "100") @Min(1) @Max(5000) int limit,
            @Parameter(description = "asc or desc") @RequestParam(defaultValue = "desc") String order) {

        TimeSeriesQuery query = TimeSeriesQuery.builder()
                .start(start)
                .end(end)
                .source(source)
                .metric(metric)
                .identityKey(ukey)
                .limit(limit)
                .order(SortOrder.fromString(order))
                .build();

        return ResponseEntity.ok(queryService.findMeasurements(query));
    }

    @GetMapping("/latest")
    @Operation(summary = "Latest version of each identity key")
    @PreAuthorize("hasAnyRole('READER', 'ADMIN')")
    public ResponseEntity<List<MeasurementResponse>> getLatest(
            @RequestParam(required = false) String ukey,
            @RequestParam(defaultValue = "100") @Min(1) @Max(5000) int limit,
            @Parameter(description = "asc or desc") @RequestParam(defaultValue = "desc") String order) {

        return ResponseEntity.ok(queryService.findLatest(ukey, limit, SortOrder.fromString(order)));
    }

    @GetMapping("/count")
    @Operation(summary = "Total stored rows, all versions")
    @PreAuthorize("hasAnyRole('READER', 'ADMIN')")
    public ResponseEntity<CountResponse> count() {
        return ResponseEntity.ok(queryService.count());
    }

    @PostMapping("/ingest")
    @Operation(
            summary = "Push measurements",
            description = "Rows go through the same versioning as the scheduled ingestion; unchanged values are not written"
    )
    @PreAuthorize("hasAnyRole('INGESTOR', 'ADMIN')")
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody IngestRequest request) {
        List<Measurement> measurements = request.getRows().stream()
                .map(MeasurementRow::toMeasurement)
                .toList();

        int inserted = ingestionService.ingest(measurements);
        log.info("Pushed {} rows, {} new versions", measurements.size(), inserted);

        return ResponseEntity.ok(new IngestResponse(inserted));
    }
}
