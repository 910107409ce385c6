package com.filesentinel.autoconfigure;

import com.filesentinel.core.SecurityOrchestrator;
import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.plugin.AnalyzerRegistry;
import com.filesentinel.core.plugin.PiiDetector;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import com.filesentinel.core.store.AuditStore;
import com.filesentinel.core.store.InMemoryAuditStore;
import com.filesentinel.module.pii.PiiPatternMatcher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class FileSentinelAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class,
                    FileSentinelAutoConfiguration.class));

    @Test
    void wiresOrchestratorWithEveryAnalyzer() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SecurityOrchestrator.class);
            assertThat(context).hasSingleBean(FileSentinelProperties.class);
            assertThat(context).hasBean("filesentinelExecutor");
            assertThat(context.getBean(PiiDetector.class)).isInstanceOf(PiiPatternMatcher.class);

            AnalyzerRegistry registry = context.getBean(AnalyzerRegistry.class);
            assertThat(registry.getAnalyzers()).extracting(ThreatAnalyzer::getId)
                    .containsExactlyInAnyOrder("hash-matching", "signature-matching", "behavior-analysis",
                            "extension-analysis", "structure-analysis");
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "filesentinel.auto-quarantine-threshold=70",
                        "filesentinel.scan-timeout=5s",
                        "filesentinel.notifications.enabled=true",
                        "filesentinel.analyzers.behavior-analysis.enabled=false")
                .run(context -> {
                    FileSentinelProperties properties = context.getBean(FileSentinelProperties.class);
                    assertThat(properties.getAutoQuarantineThreshold()).isEqualTo(70);
                    assertThat(properties.getScanTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getNotifications().isEnabled()).isTrue();
                    assertThat(properties.isAnalyzerEnabled("behavior-analysis")).isFalse();
                    assertThat(properties.isAnalyzerEnabled("hash-matching")).isTrue();
                });
    }

    @Test
    void bindsPropertiesWithoutBootPropertiesSupport() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(FileSentinelAutoConfiguration.class))
                .withPropertyValues("filesentinel.scan-timeout=5s", "filesentinel.pii-detection-enabled=false")
                .run(context -> {
                    FileSentinelProperties properties = context.getBean(FileSentinelProperties.class);
                    assertThat(properties.getScanTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.isPiiDetectionEnabled()).isFalse();
                });
    }

    @Test
    void applicationBeansReplaceDefaults() {
        contextRunner.withUserConfiguration(CustomStoreConfiguration.class).run(context -> {
            assertThat(context).hasSingleBean(AuditStore.class);
            assertThat(context.getBean(AuditStore.class)).isSameAs(CustomStoreConfiguration.STORE);
        });
    }

    @Test
    void applicationExecutorReplacesPool() {
        contextRunner.withUserConfiguration(CustomExecutorConfiguration.class).run(context -> {
            assertThat(context.getBean("filesentinelExecutor")).isSameAs(CustomExecutorConfiguration.DIRECT);
            assertThat(context).hasSingleBean(SecurityOrchestrator.class);
        });
    }

    @Test
    void disabledFlagTurnsEverythingOff() {
        contextRunner.withPropertyValues("filesentinel.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(SecurityOrchestrator.class);
            assertThat(context).doesNotHaveBean(FileSentinelProperties.class);
        });
    }

    // --- Internal classes ---

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfiguration {

        static final AuditStore STORE = new InMemoryAuditStore();

        @Bean
        AuditStore customAuditStore() {
            return STORE;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomExecutorConfiguration {

        static final Executor DIRECT = Runnable::run;

        @Bean
        Executor filesentinelExecutor() {
            return DIRECT;
        }
    }
}
