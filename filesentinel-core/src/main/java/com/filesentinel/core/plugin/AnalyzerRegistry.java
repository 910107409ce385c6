package com.filesentinel.core.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Discovers and manages all registered ThreatAnalyzers.
 * Analyzers are ordered by their {@link ThreatAnalyzer#getOrder()} priority.
 */
public class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final List<ThreatAnalyzer> analyzers;
    private final Map<String, ThreatAnalyzer> analyzerMap;

    public AnalyzerRegistry(List<ThreatAnalyzer> analyzers) {
        List<ThreatAnalyzer> sorted = new ArrayList<>(analyzers);
        sorted.sort(Comparator.comparingInt(ThreatAnalyzer::getOrder));
        this.analyzers = Collections.unmodifiableList(sorted);
        this.analyzerMap = analyzers.stream()
                .collect(Collectors.toMap(ThreatAnalyzer::getId, Function.identity()));

        log.info("[FileSentinel] Registered {} threat analyzers: {}",
                analyzers.size(),
                this.analyzers.stream().map(a -> a.getId() + "(order=" + a.getOrder() + ")")
                        .collect(Collectors.joining(", ")));
    }

    public List<ThreatAnalyzer> getAnalyzers() {
        return analyzers;
    }

    public ThreatAnalyzer getAnalyzer(String id) {
        return analyzerMap.get(id);
    }

    public List<ThreatAnalyzer> getEnabledAnalyzers(AnalyzerContext context) {
        return analyzers.stream()
                .filter(a -> a.isEnabled(context))
                .collect(Collectors.toList());
    }

    public boolean hasAnalyzer(String id) {
        return analyzerMap.containsKey(id);
    }
}
