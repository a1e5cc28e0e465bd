package com.brandflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "brandflow")
public class BrandFlowProperties {

    private SessionConfig session = new SessionConfig();
    private GenerationConfig generation = new GenerationConfig();
    private BlobConfig blob = new BlobConfig();
    private NamingConfig naming = new NamingConfig();

    public enum ProviderMode {
        HTTP, STUB
    }

    public enum NamingMode {
        CHAT, STUB
    }

    public static class SessionConfig {
        private Duration ttl = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofMinutes(10);
        private Duration retentionAfterExpiry = Duration.ofHours(1);

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { if (ttl != null) this.ttl = ttl; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { if (sweepInterval != null) this.sweepInterval = sweepInterval; }
        public Duration getRetentionAfterExpiry() { return retentionAfterExpiry; }
        public void setRetentionAfterExpiry(Duration retentionAfterExpiry) {
            if (retentionAfterExpiry != null) this.retentionAfterExpiry = retentionAfterExpiry;
        }
    }

    public static class GenerationConfig {
        private Duration globalTimeout = Duration.ofSeconds(30);
        private int maxVariants = 3;
        private int workerConcurrency = 6;
        private ProviderMode providerMode = ProviderMode.HTTP;
        private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        private List<String> denyList = new ArrayList<>();
        private String safetyQualifier = "Family-friendly commercial artwork, no text distortions, no real people.";
        private String fallbackBaseUrl = "http://localhost:8080/fallbacks";
        private Map<String, Map<String, String>> fallbacks = new LinkedHashMap<>();

        public Duration getGlobalTimeout() { return globalTimeout; }
        public void setGlobalTimeout(Duration globalTimeout) { if (globalTimeout != null) this.globalTimeout = globalTimeout; }
        public int getMaxVariants() { return maxVariants; }
        public void setMaxVariants(int maxVariants) { this.maxVariants = maxVariants; }
        public int getWorkerConcurrency() { return workerConcurrency; }
        public void setWorkerConcurrency(int workerConcurrency) { this.workerConcurrency = workerConcurrency; }
        public ProviderMode getProviderMode() { return providerMode; }
        public void setProviderMode(ProviderMode providerMode) { if (providerMode != null) this.providerMode = providerMode; }
        public Map<String, ProviderConfig> getProviders() { return providers; }
        public void setProviders(Map<String, ProviderConfig> providers) {
            if (providers == null) {
                return;
            }
            this.providers = new LinkedHashMap<>(providers);
        }
        public List<String> getDenyList() { return denyList; }
        public void setDenyList(List<String> denyList) { if (denyList != null) this.denyList = new ArrayList<>(denyList); }
        public String getSafetyQualifier() { return safetyQualifier; }
        public void setSafetyQualifier(String safetyQualifier) { this.safetyQualifier = safetyQualifier; }
        public String getFallbackBaseUrl() { return fallbackBaseUrl; }
        public void setFallbackBaseUrl(String fallbackBaseUrl) { this.fallbackBaseUrl = fallbackBaseUrl; }
        public Map<String, Map<String, String>> getFallbacks() { return fallbacks; }
        public void setFallbacks(Map<String, Map<String, String>> fallbacks) {
            if (fallbacks != null) this.fallbacks = new LinkedHashMap<>(fallbacks);
        }
    }

    public static class ProviderConfig {
        private String baseUrl;
        private String apiKey;
        private String model;
        private int maxPromptLength = 1000;
        private Duration attemptTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofMillis(500);
        private String size = "1024x1024";
        private String quality = "standard";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }
        public Duration getAttemptTimeout() { return attemptTimeout; }
        public void setAttemptTimeout(Duration attemptTimeout) { if (attemptTimeout != null) this.attemptTimeout = attemptTimeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { if (backoffBase != null) this.backoffBase = backoffBase; }
        public String getSize() { return size; }
        public void setSize(String size) { this.size = size; }
        public String getQuality() { return quality; }
        public void setQuality(String quality) { this.quality = quality; }
    }

    public static class BlobConfig {
        private String root = "./data/blobs";
        private String publicBaseUrl = "http://localhost:8080";
        private String signingKey;
        private Duration readUrlTtl = Duration.ofHours(24);
        private Duration downloadTimeout = Duration.ofSeconds(10);
        private Duration providerUrlLifetime = Duration.ofHours(1);

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }
        public String getSigningKey() { return signingKey; }
        public void setSigningKey(String signingKey) { this.signingKey = signingKey; }
        public Duration getReadUrlTtl() { return readUrlTtl; }
        public void setReadUrlTtl(Duration readUrlTtl) { if (readUrlTtl != null) this.readUrlTtl = readUrlTtl; }
        public Duration getDownloadTimeout() { return downloadTimeout; }
        public void setDownloadTimeout(Duration downloadTimeout) { if (downloadTimeout != null) this.downloadTimeout = downloadTimeout; }
        public Duration getProviderUrlLifetime() { return providerUrlLifetime; }
        public void setProviderUrlLifetime(Duration providerUrlLifetime) {
            if (providerUrlLifetime != null) this.providerUrlLifetime = providerUrlLifetime;
        }
    }

    public static class NamingConfig {
        private NamingMode mode = NamingMode.STUB;
        private int maxSuggestions = 3;
        private int maxRegenerations = 3;
        private String model;

        public NamingMode getMode() { return mode; }
        public void setMode(NamingMode mode) { if (mode != null) this.mode = mode; }
        public int getMaxSuggestions() { return maxSuggestions; }
        public void setMaxSuggestions(int maxSuggestions) { this.maxSuggestions = maxSuggestions; }
        public int getMaxRegenerations() { return maxRegenerations; }
        public void setMaxRegenerations(int maxRegenerations) { this.maxRegenerations = maxRegenerations; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public SessionConfig getSession() {
        return session;
    }

    public void setSession(SessionConfig session) {
        this.session = session != null ? session : new SessionConfig();
    }

    public GenerationConfig getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationConfig generation) {
        this.generation = generation != null ? generation : new GenerationConfig();
    }

    public BlobConfig getBlob() {
        return blob;
    }

    public void setBlob(BlobConfig blob) {
        this.blob = blob != null ? blob : new BlobConfig();
    }

    public NamingConfig getNaming() {
        return naming;
    }

    public void setNaming(NamingConfig naming) {
        this.naming = naming != null ? naming : new NamingConfig();
    }

    /**
     * Resolves the settings of one provider; unknown ids get the defaults.
     */
    public ProviderConfig getProviderConfig(String providerId) {
        ProviderConfig config = generation.getProviders().get(providerId);
        return config != null ? config : new ProviderConfig();
    }

    /**
     * Every per-attempt timeout must fit inside the fan-out deadline, otherwise one slow
     * provider could eat the whole budget.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Duration global = generation.getGlobalTimeout();
        if (global.isZero() || global.isNegative()) {
            problems.add("brandflow.generation.global-timeout must be positive");
        }
        if (generation.getMaxVariants() < 1 || generation.getMaxVariants() > 3) {
            problems.add("brandflow.generation.max-variants must be between 1 and 3");
        }
        if (generation.getProviders().isEmpty()) {
            problems.add("brandflow.generation.providers must name at least one provider");
        }
        generation.getProviders().forEach((id, provider) -> {
            if (provider.getAttemptTimeout().compareTo(global) > 0) {
                problems.add("brandflow.generation.providers." + id + ".attempt-timeout exceeds the global timeout");
            }
            if (provider.getMaxAttempts() < 1) {
                problems.add("brandflow.generation.providers." + id + ".max-attempts must be at least 1");
            }
        });
        return problems;
    }
}
