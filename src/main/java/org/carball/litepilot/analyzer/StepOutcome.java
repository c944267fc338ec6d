package org.carball.litepilot.analyzer;

import java.util.function.Supplier;

/**
 * Result of one recoverable step: either a value or the reason it could not be produced.
 */
public record StepOutcome<T>(T value, String failure) {

    public static <T> StepOutcome<T> success(T value) {
        return new StepOutcome<>(value, null);
    }

    public static <T> StepOutcome<T> failure(String failure) {
        return new StepOutcome<>(null, failure);
    }

    /**
     * Runs {@code step}, turning an unchecked failure into a failed outcome.
     */
    public static <T> StepOutcome<T> attempt(Supplier<T> step) {
        try {
            return success(step.get());
        } catch (RuntimeException e) {
            return failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public boolean succeeded() {
        return failure == null;
    }
}
