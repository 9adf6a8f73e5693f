package com.schemagov.detect;

import java.util.List;

/**
 * Compares a schema revision against a baseline. Implementations are deterministic for identical inputs and
 * raise {@link BreakingChangeDetectionException} instead of returning a partial or empty result on failure.
 */
@FunctionalInterface
public interface BreakingChangeClassifier {
    List<BreakingChange> detect(String currentSchemaRef, String baselineRef);
}
