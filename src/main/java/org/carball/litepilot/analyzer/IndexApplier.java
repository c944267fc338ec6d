package org.carball.litepilot.analyzer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.model.recommendation.IndexApplicationResult;
import org.carball.litepilot.model.recommendation.IndexRecommendation;
import org.carball.litepilot.pool.SqlExecutor;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates recommended indexes. A failing statement is reported and the rest still run.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexApplier {

    private final SqlExecutor executor;

    public IndexApplicationResult apply(List<IndexRecommendation> recommendations) {
        List<String> applied = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (IndexRecommendation recommendation : recommendations) {
            String sql = recommendation.getSql();
            StepOutcome<?> outcome = StepOutcome.attempt(() -> executor.executeAndWait(sql));
            if (outcome.succeeded()) {
                applied.add(sql);
                log.info("Created index on {}({})", recommendation.getTable(),
                        String.join(", ", recommendation.getColumns()));
            } else {
                warnings.add("Failed to create index on " + recommendation.getTable() + ": " + outcome.failure());
                log.warn("Index creation failed: {} ({})", sql, outcome.failure());
            }
        }

        return new IndexApplicationResult(applied, warnings);
    }
}
