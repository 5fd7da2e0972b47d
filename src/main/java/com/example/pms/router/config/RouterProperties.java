package com.example.pms.router.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the {@code router.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "router")
@Validated
public class RouterProperties {

    /**
     * Queries longer than this are truncated for extraction. Classification always sees the full text.
     */
    @Positive
    private int maxQueryChars = 2000;

    @Valid
    private Safety safety = new Safety();
    @Valid
    private Extraction extraction = new Extraction();
    @Valid
    private Capabilities capabilities = new Capabilities();
    @Valid
    private Relations relations = new Relations();
    @Valid
    private Rerank rerank = new Rerank();
    @Valid
    private Shadow shadow = new Shadow();
    @Valid
    private Refresh refresh = new Refresh();
    @Valid
    private Audit audit = new Audit();

    @Data
    public static class Safety {
        /**
         * Versioned rule set; swap the file to retune drift rules without a code change.
         */
        private String rulesLocation = "classpath:router/safety-rules.json";
    }

    @Data
    public static class Extraction {
        private String gazetteerLocation = "classpath:router/gazetteer.json";
        private boolean modelEnabled = true;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double lowConfidenceThreshold = 0.8;
        private Duration modelTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Capabilities {
        private String location = "classpath:router/capabilities.json";
    }

    @Data
    public static class Relations {
        @Positive
        private int limitPerDomain = 20;
        @Valid
        private TierWeights tierWeights = new TierWeights();
        /**
         * Domain keys hidden from a role. Hidden domains are still returned, empty.
         */
        private Map<String, List<String>> hiddenDomains = new HashMap<>();
    }

    @Data
    public static class TierWeights {
        private int direct = 500;
        private int sameParent = 300;
        private int sameCategory = 100;
    }

    @Data
    public static class Rerank {
        /**
         * Blend weight applied on the response path. 0 keeps FK-only ordering.
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double alpha = 0.0;
    }

    @Data
    public static class Shadow {
        private boolean enabled = false;
        /**
         * Blend weight used to compute the would-be ordering that is logged.
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double alpha = 0.5;
        private int topN = 5;
        /**
         * Alphas whose would-be orderings are logged side by side.
         */
        private List<Double> simulationAlphas = new ArrayList<>(List.of(0.0, 0.1, 0.3));
    }

    @Data
    public static class Refresh {
        private boolean enabled = false;
        private long pollIntervalMs = 3_600_000L;
        private long initialDelayMs = 60_000L;
        @Positive
        private int maxPerRun = 500;
        private int batchSize = 50;
        private Duration maxDuration = Duration.ofMinutes(30);
        @Positive
        private int concurrency = 2;
        @Min(0)
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        /**
         * Failed runs after which an entity is parked until its content changes.
         */
        private int parkAfterFailures = 3;
        @Positive
        private int circuitFailureThreshold = 10;
        private Duration circuitCooldown = Duration.ofSeconds(60);
        private int maxInputChars = 8000;
        /**
         * Expected vector size; 0 accepts whatever the model returns.
         */
        @Min(0)
        private int dimension = 0;
        private double costPerMillionTokens = 0.02;
    }

    @Data
    public static class Audit {
        private boolean enabled = false;
    }
}
