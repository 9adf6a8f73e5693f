package com.schemagov.impact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Keeps each generated migration plan as {@code <changeId>.json} under the plan directory.
 */
public class MigrationPlanStore {
    private final Path planDirectory;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public MigrationPlanStore(Path planDirectory) {
        this.planDirectory = Objects.requireNonNull(planDirectory, "planDirectory");
    }

    public void save(MigrationPlan plan) throws IOException {
        Files.createDirectories(planDirectory);
        mapper.writerWithDefaultPrettyPrinter().writeValue(pathFor(plan.changeId()).toFile(), plan);
    }

    public Optional<MigrationPlan> load(String changeId) throws IOException {
        Path path = pathFor(changeId);
        if (!Files.exists(path) || Files.size(path) == 0) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(path.toFile(), MigrationPlan.class));
    }

    private Path pathFor(String changeId) {
        if (changeId == null || changeId.isBlank() || !changeId.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("Invalid change id: " + changeId);
        }
        return planDirectory.resolve(changeId + ".json");
    }
}
