package com.schemagov.detect;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Classifier backed by {@code buf breaking}. Each JSON line emitted by buf becomes one {@link BreakingChange}.
 */
public class BufBreakingChangeClassifier implements BreakingChangeClassifier {
    private static final Logger log = LoggerFactory.getLogger(BufBreakingChangeClassifier.class);

    private final BufRunner runner;
    private final String bufPath;
    private final Path workingDirectory;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public BufBreakingChangeClassifier(BufRunner runner, String bufPath, Path workingDirectory) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.bufPath = bufPath;
        this.workingDirectory = workingDirectory;
    }

    /**
     * Findings carry no repository; callers stamp the repository the schema belongs to.
     */
    @Override
    public List<BreakingChange> detect(String currentSchemaRef, String baselineRef) {
        BufRun run = runner.run(new BufInvocation(bufPath, currentSchemaRef, baselineRef, workingDirectory));

        List<BreakingChange> changes = parse(run.stdout());
        if (changes.isEmpty() && !run.clean()) {
            throw new BreakingChangeDetectionException("buf breaking failed with exit code " + run.exitCode()
                    + ": " + run.diagnostics());
        }
        if (!changes.isEmpty() && !run.reportedViolations() && !run.clean()) {
            log.warn("detect.unexpected_exit code={} violations={}", run.exitCode(), changes.size());
        }
        log.info("detect.completed current={} baseline={} breakingChanges={}", currentSchemaRef, baselineRef, changes.size());
        return changes;
    }

    List<BreakingChange> parse(String output) {
        List<BreakingChange> changes = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return changes;
        }
        for (String line : output.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (IOException e) {
                throw new BreakingChangeDetectionException("Unparseable detector output: " + line, e);
            }
            if (node.has("violations")) {
                for (JsonNode violation : node.path("violations")) {
                    changes.add(toBreakingChange(violation));
                }
            } else {
                changes.add(toBreakingChange(node));
            }
        }
        return changes;
    }

    private BreakingChange toBreakingChange(JsonNode violation) {
        String type = violation.path("type").asText("UNKNOWN");
        String file = violation.has("path") ? violation.path("path").asText("") : violation.path("file").asText("");
        int line = violation.has("start_line") ? violation.path("start_line").asInt(0) : violation.path("line").asInt(0);
        return new BreakingChange(
                type,
                violation.path("message").asText(""),
                file + ":" + line,
                BreakingChangeRules.impactFor(type),
                null,
                null,
                null,
                BreakingChangeRules.migrationNoteFor(type));
    }
}
