package com.storeradar.discovery.config;

import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.ratelimit.RateLimitPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "discovery")
@Validated
@Data
public class DiscoveryProperties {

    @Valid
    private Output output = new Output();
    @Valid
    private Scheduling scheduling = new Scheduling();
    @Valid
    private Pipeline pipeline = new Pipeline();
    @Valid
    private Retry retry = new Retry();
    @Valid
    private Http http = new Http();
    private Map<String, Source> sources = new LinkedHashMap<>();

    /**
     * Settings for one adapter; unknown names fall back to defaults.
     */
    public Source source(String name) {
        return sources.getOrDefault(name, new Source());
    }

    public CadenceSettings cadence(Cadence cadence) {
        return switch (cadence) {
            case FAST -> scheduling.getFast();
            case DEEP -> scheduling.getDeep();
            case COMPREHENSIVE -> scheduling.getComprehensive();
            case MANUAL -> scheduling.getManual();
        };
    }

    @Data
    public static class Output {
        @NotNull
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private boolean runOnStartup = false;
        private Cadence startupCadence = Cadence.FAST;
        private Duration interAdapterDelay = Duration.ofMillis(500);
        private CadenceSettings fast = new CadenceSettings("0 */15 * * * *", PriorityTier.FREE_FAST, 500);
        private CadenceSettings deep = new CadenceSettings("0 0 */6 * * *", PriorityTier.QUOTA_LIMITED, 2000);
        private CadenceSettings comprehensive = new CadenceSettings("0 0 3 * * *", PriorityTier.EXPENSIVE, 10000);
        private CadenceSettings manual = new CadenceSettings("-", PriorityTier.EXPENSIVE, 2000);
    }

    @Data
    public static class CadenceSettings {
        private String cron;
        private PriorityTier tierCeiling;
        private List<String> adapters = new ArrayList<>();     // empty = every adapter up to the ceiling
        private int candidateQuota;

        public CadenceSettings() {
        }

        public CadenceSettings(String cron, PriorityTier tierCeiling, int candidateQuota) {
            this.cron = cron;
            this.tierCeiling = tierCeiling;
            this.candidateQuota = candidateQuota;
        }
    }

    @Data
    public static class Pipeline {
        @Min(1)
        private int workerCount = 8;
        @Min(1)
        private int probeWorkerCount = 4;
        private Duration validationTimeout = Duration.ofSeconds(60);
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;
        private Duration reclassifyDelay = Duration.ofHours(24);
        @Min(0)
        private int maxReclassificationAttempts = 5;
        @Min(1)
        private int maxProductPages = 4;
        @Min(1)
        private int dedupBatchSize = 500;
    }

    @Data
    public static class Retry {
        private Duration base = Duration.ofHours(1);
        private Duration ceiling = Duration.ofHours(24);
        @Min(0)
        private int maxRetries = 5;
        private Duration staleness = Duration.ofDays(7);
        private int seedLimit = 200;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(20);
        @NotBlank
        private String userAgent = "StoreRadar/1.0 (+https://storeradar.io/bot)";
    }

    @Data
    public static class Source {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String accessToken;
        private String searchEngineId;
        private String feedUrl;
        private List<String> queries = new ArrayList<>();
        private int pageSize = 100;
        private int maxPagesPerRun = 10;
        private Duration minDelay = Duration.ofSeconds(1);
        private Duration initialBackoff = Duration.ofMinutes(1);
        private Duration maxBackoff = Duration.ofHours(1);
        private int successStreakToReset = 5;
        private int maxRequestsPerWindow = 0;
        private Duration window = Duration.ofDays(1);

        public RateLimitPolicy rateLimitPolicy() {
            return new RateLimitPolicy(minDelay, initialBackoff, maxBackoff,
                    successStreakToReset, maxRequestsPerWindow, window);
        }
    }
}
