package com.company.powersense.service;

import com.company.powersense.domain.enums.SortOrder;
import com.company.powersense.dto.response.AnomalyResponse;
import com.company.powersense.dto.response.CountResponse;
import com.company.powersense.dto.response.MeasurementResponse;
import com.company.powersense.exception.InvalidQueryException;
import com.company.powersense.repository.AnomalyRepository;
import com.company.powersense.repository.MeasurementRepository;
import com.company.powersense.repository.TimeSeriesQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of the data API. Latest view and count are cached until the next write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MeasurementQueryService {

    private final MeasurementRepository measurementRepository;
    private final AnomalyRepository anomalyRepository;

    public List<MeasurementResponse> findMeasurements(TimeSeriesQuery query) {
        checkRange(query);
        List<MeasurementResponse> rows = measurementRepository.findMeasurements(query).stream()
                .map(MeasurementResponse::from)
                .toList();
        log.debug("Measurement query {} returned {} rows", query, rows.size());
        return rows;
    }

    @Cacheable(value = CacheEvictionService.LATEST_MEASUREMENTS_CACHE,
            key = "#identityKey + '-' + #limit + '-' + #order")
    public List<MeasurementResponse> findLatest(String identityKey, int limit, SortOrder order) {
        // Mutable list: the Redis serializer records the concrete collection type
        return measurementRepository.findLatest(identityKey, limit, order).stream()
                .map(MeasurementResponse::from)
                .collect(Collectors.toList());
    }

    @Cacheable(value = CacheEvictionService.MEASUREMENT_COUNT_CACHE, key = "'all'")
    public CountResponse count() {
        return new CountResponse(measurementRepository.count());
    }

    public List<AnomalyResponse> findAnomalies(TimeSeriesQuery query) {
        checkRange(query);
        return anomalyRepository.findAnomalies(query).stream()
                .map(AnomalyResponse::from)
                .toList();
    }

    public boolean isStoreReachable() {
        return measurementRepository.ping();
    }

    private static void checkRange(TimeSeriesQuery query) {
        if (query.getStart() != null && query.getEnd() != null && query.getStart().isAfter(query.getEnd())) {
            throw new InvalidQueryException("start must not be after end");
        }
    }
}
