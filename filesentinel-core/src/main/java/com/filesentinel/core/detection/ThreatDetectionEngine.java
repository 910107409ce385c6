package com.filesentinel.core.detection;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.intel.ThreatIntelligence;
import com.filesentinel.core.intel.ThreatIntelligenceService;
import com.filesentinel.core.model.AnalyzerDiagnostic;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.Recommendation;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatDetectionResult;
import com.filesentinel.core.plugin.AnalyzerContext;
import com.filesentinel.core.plugin.AnalyzerRegistry;
import com.filesentinel.core.plugin.ThreatAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharacterCodingException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every enabled {@link ThreatAnalyzer} against an upload and folds their
 * findings into one {@link ThreatDetectionResult}.
 *
 * <p>
 * Analyzers run in parallel on the shared executor and are joined against a
 * single deadline. An analyzer that throws contributes nothing and leaves a
 * diagnostic; a deadline overrun fails the whole scan. Results never depend on
 * which analyzer finished first.
 * </p>
 */
public class ThreatDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(ThreatDetectionEngine.class);

    public static final String ENGINE_NAME = "FileSentinel-ThreatDetector";
    public static final String ENGINE_VERSION = "1.0.0";

    private final AnalyzerRegistry registry;
    private final ThreatIntelligenceService intelligenceService;
    private final FileSentinelProperties properties;
    private final Executor executor;
    private final RiskScoring scoring;

    public ThreatDetectionEngine(AnalyzerRegistry registry, ThreatIntelligenceService intelligenceService,
            FileSentinelProperties properties, Executor executor, RiskScoring scoring) {
        this.registry = registry;
        this.intelligenceService = intelligenceService;
        this.properties = properties;
        this.executor = executor;
        this.scoring = scoring;
        log.info("[FileSentinel] {} {} started with {} analyzers",
                ENGINE_NAME, ENGINE_VERSION, registry.getAnalyzers().size());
    }

    /**
     * Scan with the engine's own settings.
     */
    public ThreatDetectionResult scan(byte[] content, FileMetadata metadata) throws ScanException {
        return scan(content, metadata, properties);
    }

    /**
     * Scan with caller-supplied settings (e.g. a stricter per-tenant profile).
     */
    public ThreatDetectionResult scan(byte[] content, FileMetadata metadata, FileSentinelProperties settings)
            throws ScanException {
        long deadline = deadlineFor(settings);
        ScanTarget target = prepare(content, metadata, settings);
        return scan(target, UUID.randomUUID().toString(), intelligenceService.current(), settings, deadline);
    }

    /**
     * Gate checks plus decoding of the shared text sample. Nothing is analyzed
     * when this throws.
     */
    public ScanTarget prepare(byte[] content, FileMetadata metadata, FileSentinelProperties settings)
            throws ScanException {
        if (!settings.isMalwareDetectionEnabled()) {
            throw new ScanException(ScanErrorCode.CONFIGURATION_DISABLED, "Malware detection is disabled");
        }
        if (content.length > settings.getMaxScanSizeBytes()) {
            throw new ScanException(ScanErrorCode.SIZE_EXCEEDED, "File '" + metadata.fileName() + "' is "
                    + content.length + " bytes, limit is " + settings.getMaxScanSizeBytes());
        }
        try {
            return ScanTarget.of(content, metadata, settings.getTextSampleBytes());
        } catch (CharacterCodingException e) {
            throw new ScanException(ScanErrorCode.DECODE_FAILURE,
                    "Could not decode text sample of '" + metadata.fileName() + "'", e);
        }
    }

    /**
     * Fan out over the enabled analyzers and merge their findings in registry
     * order.
     *
     * @param deadlineNanos {@link System#nanoTime()} value by which every
     *                      analyzer must have finished
     */
    public ThreatDetectionResult scan(ScanTarget target, String scanId, ThreatIntelligence intelligence,
            FileSentinelProperties settings, long deadlineNanos) throws ScanException {
        long started = System.nanoTime();
        Instant timestamp = Instant.now();
        AnalyzerContext context = new AnalyzerContext(settings, intelligence);
        List<ThreatAnalyzer> analyzers = registry.getEnabledAnalyzers(context);

        List<FutureTask<List<DetectedThreat>>> tasks = new ArrayList<>(analyzers.size());
        for (ThreatAnalyzer analyzer : analyzers) {
            FutureTask<List<DetectedThreat>> task = new FutureTask<>(() -> analyzer.analyze(target, context));
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                cancelAll(tasks);
                log.warn("[FileSentinel] [{}] Scan {} of '{}' rejected by executor after {} analyzers started",
                        analyzer.getId(), scanId, target.getFileName(), tasks.size());
                throw new ScanException(ScanErrorCode.EXECUTOR_REJECTED,
                        "Scan executor refused analyzer '" + analyzer.getId() + "'", e);
            }
            tasks.add(task);
        }

        List<DetectedThreat> threats = new ArrayList<>();
        List<AnalyzerDiagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            ThreatAnalyzer analyzer = analyzers.get(i);
            try {
                long remaining = deadlineNanos - System.nanoTime();
                List<DetectedThreat> found = tasks.get(i).get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                if (found != null)
                    threats.addAll(found);
            } catch (TimeoutException e) {
                cancelAll(tasks);
                log.warn("[FileSentinel] [{}] Scan {} of '{}' timed out", analyzer.getId(), scanId,
                        target.getFileName());
                throw new ScanException(ScanErrorCode.TIMEOUT, "Analyzer '" + analyzer.getId()
                        + "' did not finish within " + settings.getScanTimeout(), e);
            } catch (InterruptedException e) {
                cancelAll(tasks);
                Thread.currentThread().interrupt();
                throw new ScanException(ScanErrorCode.INTERRUPTED, "Scan " + scanId + " was interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[FileSentinel] [{}] Analyzer threw exception: {}", analyzer.getId(), cause.toString());
                diagnostics.add(new AnalyzerDiagnostic(analyzer.getId(), cause.toString()));
            }
        }

        int threshold = settings.getConfidenceThreshold();
        List<DetectedThreat> accepted = threats.stream()
                .filter(t -> t.confidence() >= threshold)
                .toList();

        int riskScore = scoring.riskScore(accepted);
        Severity severity = scoring.overallSeverity(accepted, riskScore);
        Recommendation recommendation = RiskScoring.recommend(riskScore, severity);

        ThreatDetectionResult result = ThreatDetectionResult.builder()
                .scanId(scanId)
                .fileId(target.getMetadata().fileId())
                .fileName(target.getFileName())
                .threats(accepted)
                .riskScore(riskScore)
                .overallSeverity(severity)
                .recommendation(recommendation)
                .scanDuration(Duration.ofNanos(System.nanoTime() - started))
                .scanTimestamp(timestamp)
                .engine(ENGINE_NAME, ENGINE_VERSION)
                .intelligenceVersion(intelligence.getVersion())
                .diagnostics(diagnostics)
                .build();

        if (result.hasThreats()) {
            log.warn("[FileSentinel] Scan {} of '{}': {} threats, risk {}, severity {} -> {}",
                    scanId, target.getFileName(), accepted.size(), riskScore, severity, recommendation);
        } else {
            log.debug("[FileSentinel] Scan {} of '{}' is clean", scanId, target.getFileName());
        }
        return result;
    }

    /**
     * Absolute deadline for a scan starting now.
     */
    public static long deadlineFor(FileSentinelProperties settings) {
        return System.nanoTime() + settings.getScanTimeout().toNanos();
    }

    public FileSentinelProperties getProperties() {
        return properties;
    }

    private static void cancelAll(List<? extends FutureTask<?>> tasks) {
        for (FutureTask<?> task : tasks) {
            task.cancel(true);
        }
    }
}
