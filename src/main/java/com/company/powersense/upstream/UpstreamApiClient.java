package com.company.powersense.upstream;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.RawRecord;
import com.company.powersense.exception.UpstreamConfigurationException;
import com.company.powersense.util.TimeUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Paged reader of the upstream records endpoint.
 * <p>
 * Requests are windowed with {@code where date_heure > now - window} and paged with
 * {@code limit}/{@code offset} until an empty or short page comes back.
 */
@Component
@Slf4j
public class UpstreamApiClient {

    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final Retry upstreamRetry;
    private final ObjectMapper objectMapper;
    private final PowerSenseProperties.Upstream config;

    public UpstreamApiClient(@Qualifier("upstreamRestClient") RestClient restClient,
                             @Qualifier("upstreamRetry") Retry upstreamRetry,
                             ObjectMapper objectMapper,
                             PowerSenseProperties properties) {
        this.restClient = restClient;
        this.upstreamRetry = upstreamRetry;
        this.objectMapper = objectMapper;
        this.config = properties.getUpstream();
    }

    /**
     * All records newer than {@code now - window}.
     *
     * @throws UpstreamConfigurationException when the URL is missing or unusable
     */
    public List<RawRecord> fetchRecent(Instant now) {
        String where = "date_heure > '" + TimeUtils.toIsoSeconds(now.minus(config.getWindow())) + "'";
        int pageSize = Math.max(1, config.getPageSize());

        List<RawRecord> records = new ArrayList<>();
        int offset = 0;
        int pages = 0;
        while (true) {
            URI uri = pageUri(where, pageSize, offset);
            List<RawRecord> page = fetchPage(uri);
            pages++;

            records.addAll(page);
            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }

        log.info("Fetched {} upstream records in {} pages ({})", records.size(), pages, where);
        return records;
    }

    URI pageUri(String where, int limit, int offset) {
        String url = config.getUrl();
        if (url == null || url.isBlank()) {
            throw new UpstreamConfigurationException("Upstream URL is not configured (powersense.upstream.url)");
        }

        try {
            return UriComponentsBuilder.fromHttpUrl(url.trim())
                    .replaceQueryParam("where", UriUtils.encodeQueryParam(where, StandardCharsets.UTF_8))
                    .replaceQueryParam("limit", limit)
                    .replaceQueryParam("offset", offset)
                    .build(true)
                    .toUri();
        } catch (IllegalArgumentException e) {
            throw new UpstreamConfigurationException("Malformed upstream URL: " + url, e);
        }
    }

    private List<RawRecord> fetchPage(URI uri) {
        JsonNode body;
        try {
            body = Retry.decorateSupplier(upstreamRetry,
                    () -> restClient.get().uri(uri).retrieve().body(JsonNode.class)).get();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof UnknownHostException) {
                throw new UpstreamConfigurationException("Upstream host cannot be resolved: " + uri.getHost(), e);
            }
            throw e;
        }

        JsonNode results = body != null ? body.get("results") : null;
        if (results == null || !results.isArray()) {
            log.warn("Upstream page {} carried no results array", uri);
            return List.of();
        }

        List<RawRecord> page = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            if (result.isObject()) {
                page.add(RawRecord.of(objectMapper.convertValue(result, FIELD_MAP)));
            }
        }
        return page;
    }
}
