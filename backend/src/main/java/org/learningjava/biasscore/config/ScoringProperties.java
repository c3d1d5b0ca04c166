package org.learningjava.biasscore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    private String compositeConfig = "classpath:composite_score_config.json";
    private final Provider provider = new Provider();
    private final Ensemble ensemble = new Ensemble();
    private final Progress progress = new Progress();
    private final ViewCache viewCache = new ViewCache();
    private final Runner runner = new Runner();

    public String getCompositeConfig() { return compositeConfig; }
    public void setCompositeConfig(String v) { this.compositeConfig = v; }
    public Provider getProvider() { return provider; }
    public Ensemble getEnsemble() { return ensemble; }
    public Progress getProgress() { return progress; }
    public ViewCache getViewCache() { return viewCache; }
    public Runner getRunner() { return runner; }

    public static class Provider {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String referer = "http://localhost";
        private String title = "biasscore";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxTokens = 512;
        private double temperature = 0.0;
        private int maxRetries = 2;
        private Duration backoff = Duration.ofSeconds(1);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String v) { this.baseUrl = v; }
        public String getReferer() { return referer; }
        public void setReferer(String v) { this.referer = v; }
        public String getTitle() { return title; }
        public void setTitle(String v) { this.title = v; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration v) { this.timeout = v; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int v) { this.maxTokens = v; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double v) { this.temperature = v; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int v) { this.maxRetries = v; }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration v) { this.backoff = v; }
    }

    public static class Ensemble {
        private int minValid = 1;
        private int maxAttempts = 6;
        private double confidenceThreshold = 0.5;
        private int poolSize = 3;

        public int getMinValid() { return minValid; }
        public void setMinValid(int v) { this.minValid = v; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int v) { this.maxAttempts = v; }
        public double getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(double v) { this.confidenceThreshold = v; }
        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int v) { this.poolSize = v; }
    }

    public static class Progress {
        private boolean cleanupEnabled = true;
        private Duration cleanupInterval = Duration.ofMinutes(1);

        public boolean isCleanupEnabled() { return cleanupEnabled; }
        public void setCleanupEnabled(boolean v) { this.cleanupEnabled = v; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration v) { this.cleanupInterval = v; }
    }

    public static class ViewCache {
        private Duration ttl = Duration.ofMinutes(10);
        private long maximumSize = 1000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration v) { this.ttl = v; }
        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long v) { this.maximumSize = v; }
    }

    public static class Runner {
        private boolean enabled = false;
        private int batchSize = 20;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int v) { this.batchSize = v; }
    }
}
