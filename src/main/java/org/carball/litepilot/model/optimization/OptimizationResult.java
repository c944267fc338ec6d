package org.carball.litepilot.model.optimization;

import lombok.Data;
import org.carball.litepilot.model.recommendation.ImpactLevel;

import java.util.ArrayList;
import java.util.List;

@Data
public class OptimizationResult {
    private List<String> appliedOptimizations = new ArrayList<>();
    private List<String> maintenanceTasks = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
    private ImpactLevel performanceImpact = ImpactLevel.LOW;
    private List<String> warnings = new ArrayList<>();

    public void addApplied(String description) {
        appliedOptimizations.add(description);
    }

    public void addMaintenanceTask(String description) {
        maintenanceTasks.add(description);
    }

    public void addRecommendation(String recommendation) {
        recommendations.add(recommendation);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
