package org.carball.litepilot;

import org.carball.litepilot.model.optimization.OptimizationResult;
import org.carball.litepilot.model.recommendation.IndexAnalysisResult;

import java.util.Optional;

/**
 * Outcome of one {@link SqliteAutopilot#runMaintenance} pass. The index analysis is absent when
 * automatic indexing is switched off.
 */
public record MaintenanceReport(OptimizationResult optimization, IndexAnalysisResult indexAnalysis) {

    public Optional<IndexAnalysisResult> findIndexAnalysis() {
        return Optional.ofNullable(indexAnalysis);
    }
}
