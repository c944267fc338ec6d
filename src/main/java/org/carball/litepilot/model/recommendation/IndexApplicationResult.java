package org.carball.litepilot.model.recommendation;

import java.util.List;

/**
 * Statements that created an index, and one warning per statement that failed.
 */
public record IndexApplicationResult(List<String> appliedStatements, List<String> warnings) {

    public IndexApplicationResult {
        appliedStatements = List.copyOf(appliedStatements);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
