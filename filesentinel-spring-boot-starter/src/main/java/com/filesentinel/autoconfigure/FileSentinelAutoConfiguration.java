package com.filesentinel.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesentinel.core.SecurityOrchestrator;
import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.detection.RiskScoring;
import com.filesentinel.core.detection.ThreatDetectionEngine;
import com.filesentinel.core.intel.InMemoryThreatIntelligenceRepository;
import com.filesentinel.core.intel.ThreatIntelligenceRepository;
import com.filesentinel.core.intel.ThreatIntelligenceService;
import com.filesentinel.core.plugin.AnalyzerRegistry;
import com.filesentinel.core.plugin.PiiDetector;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import com.filesentinel.core.policy.ResponsePolicyEngine;
import com.filesentinel.core.response.RedactionTokens;
import com.filesentinel.core.response.ResponseExecutor;
import com.filesentinel.core.response.Sanitizer;
import com.filesentinel.core.store.AuditStore;
import com.filesentinel.core.store.AuditTrail;
import com.filesentinel.core.store.BlobStore;
import com.filesentinel.core.store.InMemoryAuditStore;
import com.filesentinel.core.store.InMemoryBlobStore;
import com.filesentinel.core.store.InMemoryReferenceDataCache;
import com.filesentinel.core.store.LoggingNotificationChannel;
import com.filesentinel.core.store.NotificationChannel;
import com.filesentinel.core.store.ReferenceDataCache;
import com.filesentinel.core.store.StorageFailureMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Auto-configuration for FileSentinel.
 * Activated when {@code filesentinel.enabled=true} (default).
 *
 * <p>
 * Every collaborator is a default that an application replaces by declaring its
 * own bean, e.g. a persistent {@link AuditStore} or a mail backed
 * {@link NotificationChannel}.
 * </p>
 */
@AutoConfiguration
@ConditionalOnProperty(name = "filesentinel.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties
@ComponentScan(basePackages = "com.filesentinel.module")
public class FileSentinelAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FileSentinelAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "filesentinel")
    public FileSentinelProperties fileSentinelProperties() {
        return new FileSentinelProperties();
    }

    // --- Storage ---

    @Bean
    @ConditionalOnMissingBean
    public BlobStore blobStore() {
        log.info("[FileSentinel] Using InMemoryBlobStore (provide a BlobStore bean for durable quarantine)");
        return new InMemoryBlobStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditStore auditStore() {
        log.info("[FileSentinel] Using InMemoryAuditStore (provide an AuditStore bean for a durable audit log)");
        return new InMemoryAuditStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReferenceDataCache referenceDataCache() {
        return new InMemoryReferenceDataCache();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationChannel notificationChannel() {
        return new LoggingNotificationChannel();
    }

    @Bean
    @ConditionalOnMissingBean
    public StorageFailureMonitor storageFailureMonitor() {
        return new StorageFailureMonitor();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditTrail auditTrail(AuditStore auditStore, StorageFailureMonitor monitor) {
        return new AuditTrail(auditStore, monitor);
    }

    // --- Threat intelligence ---

    @Bean
    @ConditionalOnMissingBean
    public ThreatIntelligenceRepository threatIntelligenceRepository() {
        return new InMemoryThreatIntelligenceRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreatIntelligenceService threatIntelligenceService(ThreatIntelligenceRepository repository,
            ReferenceDataCache cache, FileSentinelProperties properties) {
        return new ThreatIntelligenceService(repository, cache, properties);
    }

    // --- Detection ---

    @Bean
    @ConditionalOnMissingBean
    public RiskScoring riskScoring() {
        return new RiskScoring();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalyzerRegistry analyzerRegistry(List<ThreatAnalyzer> analyzers) {
        return new AnalyzerRegistry(analyzers);
    }

    @Bean
    @ConditionalOnMissingBean(name = "filesentinelExecutor")
    public Executor filesentinelExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(6);
        executor.setMaxPoolSize(12);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("filesentinel-scan-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreatDetectionEngine threatDetectionEngine(AnalyzerRegistry registry,
            ThreatIntelligenceService intelligenceService, FileSentinelProperties properties,
            @Qualifier("filesentinelExecutor") Executor filesentinelExecutor, RiskScoring riskScoring) {
        return new ThreatDetectionEngine(registry, intelligenceService, properties, filesentinelExecutor, riskScoring);
    }

    // --- Response ---

    @Bean
    @ConditionalOnMissingBean
    public ResponsePolicyEngine responsePolicyEngine() {
        return new ResponsePolicyEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RedactionTokens redactionTokens() {
        return RedactionTokens.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sanitizer sanitizer(RedactionTokens redactionTokens) {
        return new Sanitizer(redactionTokens);
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper filesentinelObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseExecutor responseExecutor(BlobStore blobStore, AuditTrail auditTrail,
            NotificationChannel notificationChannel, FileSentinelProperties properties, Sanitizer sanitizer,
            ObjectMapper objectMapper) {
        return new ResponseExecutor(blobStore, auditTrail, notificationChannel, properties, sanitizer, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityOrchestrator securityOrchestrator(ThreatDetectionEngine threatDetectionEngine,
            PiiDetector piiDetector, ResponsePolicyEngine policyEngine, ResponseExecutor responseExecutor,
            ThreatIntelligenceService intelligenceService, AuditTrail auditTrail, FileSentinelProperties properties,
            @Qualifier("filesentinelExecutor") Executor filesentinelExecutor) {
        log.info("[FileSentinel] Security orchestrator ready (malware={}, pii={}, behavior={})",
                properties.isMalwareDetectionEnabled(), properties.isPiiDetectionEnabled(),
                properties.isBehaviorAnalysisEnabled());
        return new SecurityOrchestrator(threatDetectionEngine, piiDetector, policyEngine, responseExecutor,
                intelligenceService, auditTrail, properties, filesentinelExecutor);
    }
}
