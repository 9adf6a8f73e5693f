package com.schemagov.dependency;

/**
 * A schema target that the analysed target itself consumes.
 */
public record ReverseDependency(String target, DependencyKind kind, DependencyStrength strength) {
}
