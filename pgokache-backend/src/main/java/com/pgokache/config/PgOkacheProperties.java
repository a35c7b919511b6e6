package com.pgokache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed binding for the {@code pgokache.*} settings in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "pgokache")
public class PgOkacheProperties {

    /** How long a second check/collect waits for the in-flight one; 0 rejects immediately. */
    private long lockWaitMs = 0;

    /** Base64 AES key for saved passwords; a random key is generated when empty. */
    private String credentialKey;

    private Target target = new Target();
    private Collector collector = new Collector();
    private Advisor advisor = new Advisor();

    @Data
    public static class Target {
        private int connectTimeoutMs = 5000;
        private int queryTimeoutMs = 5000;
        private String applicationName = "pgokache";
    }

    @Data
    public static class Collector {
        private int topN = 100;
        private int displayTop = 8;
        private int maxQueryLength = 2000;
        private boolean storeFullQueryText = false;
        private long minCalls = 5;
        private double minTotalTimeMs = 50;
    }

    @Data
    public static class Advisor {
        private boolean runAfterCollect = true;

        private long indexMinCalls = 50;
        private double indexReadRatio = 100;
        private long highConfidenceCalls = 1000;
        private long mediumConfidenceCalls = 200;
        private double highConfidenceReadRatio = 1000;

        private double tempBlocksPerCall = 100;
        /** Spill of this many times {@code tempBlocksPerCall} counts as strong evidence. */
        private double tempSpillHighConfidenceRatio = 10;

        private double replicaMinTotalTimeMs = 10_000;
        private double replicaReadShare = 0.8;
        private double replicaHighReadShare = 0.95;
        private long replicaHighReadCalls = 10_000;

        /** New per-call evidence must reach this multiple of a dismissed/applied one to reopen it. */
        private double resurrectFactor = 2.0;
    }
}
