package com.company.powersense.ingest;

import com.company.powersense.domain.Measurement;
import com.company.powersense.util.TimeUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the identity key ("ukey") naming one logical point of the time series.
 * <p>
 * The key is compact JSON of {date, metric, nature, perimetre, time} with keys in sorted order,
 * e.g. {@code {"date":"20250101","metric":"consommation","nature":"Données temps réel","perimetre":"France","time":"10:15:00"}}.
 * Equal logical inputs always give byte-identical keys; non-ASCII characters are written as-is.
 */
@Component
public class IdentityKeyBuilder {

    private final ObjectMapper objectMapper;

    public IdentityKeyBuilder() {
        // Private mapper: the application mapper may carry features that change the output
        this.objectMapper = new ObjectMapper();
    }

    public String build(Instant timestamp, String perimeter, String nature, String metric) {
        Map<String, String> payload = new TreeMap<>();
        payload.put("perimetre", perimeter);
        payload.put("nature", nature);
        payload.put("metric", metric);
        payload.put("date", TimeUtils.KEY_DATE.format(timestamp));
        payload.put("time", TimeUtils.KEY_TIME.format(timestamp));

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize identity key " + payload, e);
        }
    }

    public String build(Measurement measurement) {
        return build(measurement.getTimestamp(), measurement.getPerimeter(),
                measurement.getNature(), measurement.getMetric());
    }
}
