package com.company.powersense.config;

import com.company.powersense.domain.enums.VersioningMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * All tunables of the service, bound once from {@code powersense.*}.
 * Components receive this object (or one of its sections) by constructor.
 */
@Data
@ConfigurationProperties(prefix = "powersense")
public class PowerSenseProperties {

    private Upstream upstream = new Upstream();
    private Ingestion ingestion = new Ingestion();
    private Store store = new Store();
    private Anomaly anomaly = new Anomaly();
    private History history = new History();
    private Cache cache = new Cache();
    private Tracing tracing = new Tracing();

    @Data
    public static class Upstream {
        private String url = "https://odre.opendatasoft.com/api/explore/v2.1/catalog/datasets/eco2mix-national-tr/records?order_by=date_heure%20DESC";
        private int pageSize = 100;
        // Only records newer than now - window are requested
        private Duration window = Duration.ofHours(24);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Ingestion {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofSeconds(20);
        private String defaultSource = "France";
        private VersioningMode versioningMode = VersioningMode.SEQUENTIAL;
    }

    @Data
    public static class Store {
        private int stateChunkSize = 500;
        private int insertChunkSize = 5000;
        private int maxAttempts = 5;
        // Linear backoff: retryDelay * attempt
        private Duration retryDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Anomaly {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
        private Duration initialDelay = Duration.ofMinutes(1);
        private String metric = "consommation";
        private Duration lookback = Duration.ofDays(28);
        private Duration evaluationWindow = Duration.ofHours(1);
        private int minSamples = 3;
        private double zscoreThreshold = 3.0;
        private Duration fetchChunk = Duration.ofHours(24);
    }

    @Data
    public static class History {
        private boolean enabled = true;
        private String url = "https://www.data.gouv.fr/api/1/datasets/r/1ae6c731-991f-4441-9663-adc99005fac5";
        // Rows dated after today - maxAge are left to the real-time feed
        private Duration maxAge = Duration.ofDays(1);
        private Duration readTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(1);
    }

    @Data
    public static class Tracing {
        private boolean enabled = false;
    }
}
