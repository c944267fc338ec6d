package org.carball.litepilot.model.recommendation;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class IndexRecommendation {
    private String table;
    private List<String> columns;
    private IndexType type;
    private Priority priority;
    private String reason;
    private ImpactLevel estimatedImpact;
    private String sql;

    /**
     * Ranking score: priority weight times impact weight.
     */
    public int getScore() {
        return priority.getWeight() * estimatedImpact.getWeight();
    }
}
