package com.schemagov.dependency;

public class DependencyAnalysisException extends RuntimeException {
    public DependencyAnalysisException(String message) {
        super(message);
    }
}
