package com.schemagov.detect;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One {@code buf breaking} call: the schema input, the ref it is compared against and where buf runs.
 */
public record BufInvocation(String bufPath, String input, String against, Path workingDirectory) {
    public BufInvocation {
        bufPath = bufPath == null || bufPath.isBlank() ? "buf" : bufPath;
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(against, "against");
    }

    public List<String> argv() {
        return List.of(bufPath, "breaking", input, "--against", against, "--error-format", "json");
    }
}
