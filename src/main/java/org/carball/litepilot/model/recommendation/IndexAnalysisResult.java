package org.carball.litepilot.model.recommendation;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class IndexAnalysisResult {
    private List<IndexRecommendation> recommendations;
    private List<String> existingIndexes;
    private List<String> redundantIndexes;
    private List<String> missingIndexes;
    private ImpactLevel performanceImpact;
    private String summary;

    // Index lookups that failed and were treated as "no index"
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
