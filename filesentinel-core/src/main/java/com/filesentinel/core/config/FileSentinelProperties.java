package com.filesentinel.core.config;

import com.filesentinel.core.model.AccessLevel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core configuration properties for FileSentinel.
 * These map directly to the `filesentinel.*` properties in your application.yml.
 */
public class FileSentinelProperties {

    private boolean enabled = true;

    // The detection toggles can be flipped at runtime by an emergency lockdown
    private volatile boolean malwareDetectionEnabled = true;
    private volatile boolean piiDetectionEnabled = true;
    private boolean behaviorAnalysisEnabled = true;

    private long maxScanSizeBytes = 50L * 1024 * 1024;
    private int textSampleBytes = 1024 * 1024;
    private Duration scanTimeout = Duration.ofSeconds(30);

    private int confidenceThreshold = 0;
    private int autoQuarantineThreshold = 85;
    private int notifyThreshold = 10;

    private NotificationProperties notifications = new NotificationProperties();
    private QuarantineProperties quarantine = new QuarantineProperties();
    private IntelligenceProperties intelligence = new IntelligenceProperties();
    private Map<String, AnalyzerProperties> analyzers = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMalwareDetectionEnabled() {
        return malwareDetectionEnabled;
    }

    public void setMalwareDetectionEnabled(boolean malwareDetectionEnabled) {
        this.malwareDetectionEnabled = malwareDetectionEnabled;
    }

    public boolean isPiiDetectionEnabled() {
        return piiDetectionEnabled;
    }

    public void setPiiDetectionEnabled(boolean piiDetectionEnabled) {
        this.piiDetectionEnabled = piiDetectionEnabled;
    }

    public boolean isBehaviorAnalysisEnabled() {
        return behaviorAnalysisEnabled;
    }

    public void setBehaviorAnalysisEnabled(boolean behaviorAnalysisEnabled) {
        this.behaviorAnalysisEnabled = behaviorAnalysisEnabled;
    }

    public long getMaxScanSizeBytes() {
        return maxScanSizeBytes;
    }

    public void setMaxScanSizeBytes(long maxScanSizeBytes) {
        this.maxScanSizeBytes = maxScanSizeBytes;
    }

    /**
     * How much of a file is decoded as text for regex work. One bounded sample,
     * shared by signatures, behavior heuristics and PII patterns.
     */
    public int getTextSampleBytes() {
        return textSampleBytes;
    }

    public void setTextSampleBytes(int textSampleBytes) {
        this.textSampleBytes = textSampleBytes;
    }

    public Duration getScanTimeout() {
        return scanTimeout;
    }

    public void setScanTimeout(Duration scanTimeout) {
        this.scanTimeout = scanTimeout;
    }

    /** Threats reported below this confidence are dropped before scoring. */
    public int getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(int confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getAutoQuarantineThreshold() {
        return autoQuarantineThreshold;
    }

    public void setAutoQuarantineThreshold(int autoQuarantineThreshold) {
        this.autoQuarantineThreshold = autoQuarantineThreshold;
    }

    /** Minimum risk score before the global notification rule kicks in. */
    public int getNotifyThreshold() {
        return notifyThreshold;
    }

    public void setNotifyThreshold(int notifyThreshold) {
        this.notifyThreshold = notifyThreshold;
    }

    public NotificationProperties getNotifications() {
        return notifications;
    }

    public void setNotifications(NotificationProperties notifications) {
        this.notifications = notifications;
    }

    public QuarantineProperties getQuarantine() {
        return quarantine;
    }

    public void setQuarantine(QuarantineProperties quarantine) {
        this.quarantine = quarantine;
    }

    public IntelligenceProperties getIntelligence() {
        return intelligence;
    }

    public void setIntelligence(IntelligenceProperties intelligence) {
        this.intelligence = intelligence;
    }

    public Map<String, AnalyzerProperties> getAnalyzers() {
        return analyzers;
    }

    public void setAnalyzers(Map<String, AnalyzerProperties> analyzers) {
        this.analyzers = analyzers;
    }

    /**
     * Useful for checking if a specific analyzer is turned on.
     * Note: analyzers are enabled by default unless explicitly disabled.
     */
    public boolean isAnalyzerEnabled(String analyzerId) {
        AnalyzerProperties props = analyzers.get(analyzerId);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    /**
     * Grab any custom settings specific to an analyzer.
     */
    public Map<String, Object> getAnalyzerConfig(String analyzerId) {
        AnalyzerProperties props = analyzers.get(analyzerId);
        if (props == null)
            return Map.of();
        return props.getConfig();
    }

    public static class NotificationProperties {
        private boolean enabled = false;
        private EmailProperties email = new EmailProperties();
        private WebhookProperties webhook = new WebhookProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public EmailProperties getEmail() {
            return email;
        }

        public void setEmail(EmailProperties email) {
            this.email = email;
        }

        public WebhookProperties getWebhook() {
            return webhook;
        }

        public void setWebhook(WebhookProperties webhook) {
            this.webhook = webhook;
        }
    }

    public static class EmailProperties {
        private boolean enabled = false;
        private List<String> recipients = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getRecipients() {
            return recipients;
        }

        public void setRecipients(List<String> recipients) {
            this.recipients = recipients;
        }
    }

    public static class WebhookProperties {
        private boolean enabled = false;
        private String url;
        private Map<String, String> headers = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }

    public static class QuarantineProperties {
        private Duration retention = Duration.ofDays(30);
        private Duration reviewWindow = Duration.ofDays(7);
        private AccessLevel accessLevel = AccessLevel.SECURITY;

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getReviewWindow() {
            return reviewWindow;
        }

        public void setReviewWindow(Duration reviewWindow) {
            this.reviewWindow = reviewWindow;
        }

        public AccessLevel getAccessLevel() {
            return accessLevel;
        }

        public void setAccessLevel(AccessLevel accessLevel) {
            this.accessLevel = accessLevel;
        }
    }

    public static class IntelligenceProperties {
        private Duration cacheTtl = Duration.ofMinutes(5);

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    public static class AnalyzerProperties {
        private boolean enabled = true;
        private Map<String, Object> config = new HashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config;
        }
    }
}
