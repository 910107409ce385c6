package com.filesentinel.core.support;

import com.filesentinel.core.detection.ScanTarget;
import com.filesentinel.core.model.DetectedThreat;
import com.filesentinel.core.plugin.AnalyzerContext;
import com.filesentinel.core.plugin.ThreatAnalyzer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Analyzer with scripted behaviour: fixed findings, an exception, or a stall
 * until interrupted.
 */
public class StubAnalyzer implements ThreatAnalyzer {

    private final String id;
    private final int order;
    private final List<DetectedThreat> threats;
    private final RuntimeException failure;
    private final Duration stall;
    private final AtomicBoolean interrupted = new AtomicBoolean();

    private StubAnalyzer(String id, int order, List<DetectedThreat> threats, RuntimeException failure,
            Duration stall) {
        this.id = id;
        this.order = order;
        this.threats = threats;
        this.failure = failure;
        this.stall = stall;
    }

    public static StubAnalyzer returning(String id, int order, DetectedThreat... threats) {
        return new StubAnalyzer(id, order, List.of(threats), null, null);
    }

    public static StubAnalyzer failing(String id, int order, RuntimeException failure) {
        return new StubAnalyzer(id, order, List.of(), failure, null);
    }

    public static StubAnalyzer stalling(String id, int order, Duration stall) {
        return new StubAnalyzer(id, order, List.of(), null, stall);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return "Stub " + id;
    }

    @Override
    public int getOrder() {
        return order;
    }

    @Override
    public List<DetectedThreat> analyze(ScanTarget target, AnalyzerContext context) {
        if (failure != null)
            throw failure;
        if (stall != null) {
            try {
                Thread.sleep(stall.toMillis());
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
        }
        return threats;
    }

    public boolean wasInterrupted() {
        return interrupted.get();
    }
}
