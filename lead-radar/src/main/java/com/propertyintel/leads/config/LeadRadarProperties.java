package com.propertyintel.leads.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "lead-radar")
@Data
public class LeadRadarProperties {

    /** Upper bound on the raw snapshot size pulled from Realie. */
    private int maxProperties = 500;

    private Realie realie = new Realie();
    private Cache cache = new Cache();
    private Scheduling scheduling = new Scheduling();
    private Scoring scoring = new Scoring();

    @Data
    public static class Realie {
        private String apiKey = "";
        private String baseUrl = "https://app.realie.ai/api/public/property/search/";
        private int pageSize = 100;
        private long requestTimeoutMs = 10_000;
    }

    @Data
    public static class Cache {
        private long ttlSeconds = 300;
        private Backend backend = Backend.MEMORY;
        private String namespace = "lead-radar";

        public enum Backend {
            MEMORY, REDIS
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private long refreshIntervalSeconds = 900;
        private long shutdownAwaitSeconds = 10;
    }

    @Data
    public static class Scoring {
        private double equityWeight = 0.45;
        private double valueGapWeight = 0.35;
        private double recencyWeight = 0.20;
    }
}
