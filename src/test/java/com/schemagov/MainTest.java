package com.schemagov;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.schemagov.detect.BreakingChange;
import com.schemagov.detect.BreakingChangeClassifier;
import com.schemagov.detect.ImpactTier;
import com.schemagov.runtime.GovernanceConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    private static final String CONFIG = """
            schema_governance:
              review_policies:
                default:
                  required_reviewers: ["@platform-team"]
                  approval_count: 1
                  auto_approve_minor: true
              breaking_change_policies:
                default: require_approval
              team_overrides: {}
            teams:
              platform-team:
                repositories: ["acme/platform-schemas"]
                members:
                  - username: alice
                    role: maintainer
              payments-team:
                repositories: ["acme/payments-schemas"]
                settings:
                  require_review_all_changes: true
                members:
                  - username: erin
                    role: admin
            """;

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final List<String> detectedTargets = new ArrayList<>();

    @TempDir
    Path tempDir;

    private Path configPath;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("governance.yml");
        Files.writeString(configPath, CONFIG);
    }

    @Test
    void shouldTrackChangeAndListItInHistory() throws Exception {
        Result tracked = run("--mode", "track", "--change-id", "CHG_cli_1", "--kind", "addition",
                "--target", "acme/platform/v1/audit.proto", "--repository", "acme/platform-schemas", "--author", "alice");

        assertEquals(0, tracked.exitCode());
        JsonNode record = mapper.readTree(tracked.output());
        assertEquals("platform-team", record.get("owningTeam").asText());
        assertEquals("not_required", record.get("approvalState").asText());

        Result history = run("--mode", "history", "--team", "platform-team");
        assertEquals(0, history.exitCode());
        assertEquals("CHG_cli_1", mapper.readTree(history.output()).get(0).get("changeId").asText());
        assertTrue(Files.exists(tempDir.resolve("storage/changes.json")));
        assertTrue(Files.readString(tempDir.resolve("storage/audit.jsonl")).contains("change_tracked"));
    }

    @Test
    void shouldApproveReviewAndSyncChange() throws Exception {
        Result tracked = run("--mode", "track", "--change-id", "CHG_cli_2", "--kind", "modification",
                "--target", "acme/payments/v1/refund.proto", "--repository", "acme/payments-schemas", "--baseline", "main");
        assertEquals(0, tracked.exitCode());
        assertEquals(List.of("acme/payments/v1/refund.proto"), detectedTargets);
        String reviewId = mapper.readTree(tracked.output()).get("reviewId").asText();

        Result approved = run("--mode", "approve", "--review-id", reviewId, "--reviewer", "erin", "--comment", "ok");
        assertEquals(0, approved.exitCode());
        assertTrue(mapper.readTree(approved.output()).get("approved").asBoolean());

        Result synced = run("--mode", "sync", "--change-id", "CHG_cli_2");
        assertEquals("approved", mapper.readTree(synced.output()).get("approvalState").asText());
    }

    @Test
    void shouldRequireApprovalForDetectedBreakingChanges() throws Exception {
        Path changesFile = tempDir.resolve("breaking.json");
        mapper.writeValue(changesFile.toFile(), List.of(new BreakingChange("FIELD_NO_DELETE", "Field 3 deleted",
                "acme/platform/v1/user.proto:22", ImpactTier.HIGH, "acme/platform-schemas", null, null, null)));

        Result pending = run("--mode", "check_policy", "--breaking-changes-file", changesFile.toString());
        assertEquals("require_approval", mapper.readTree(pending.output()).get("action").asText());

        Result approval = run("--mode", "approve_breaking", "--reviewer", "alice", "--target", "acme/platform/v1/user.proto",
                "--breaking-changes-file", changesFile.toString());
        assertEquals(1, mapper.readTree(approval.output()).get("newlyApproved").asInt());

        Result allowed = run("--mode", "check_policy", "--breaking-changes-file", changesFile.toString());
        assertEquals("allow", mapper.readTree(allowed.output()).get("action").asText());
    }

    @Test
    void shouldRegisterDependencyAndAnalyzeImpact() throws Exception {
        assertEquals(0, run("--mode", "register_dependency", "--target", "acme/platform/v1/user.proto",
                "--service", "profile-svc", "--strength", "critical", "--owning-team", "api-team").exitCode());

        Result analysis = run("--mode", "analyze", "--target", "acme/platform/v1/user.proto");

        assertEquals(0, analysis.exitCode());
        JsonNode report = mapper.readTree(analysis.output());
        assertEquals("profile-svc", report.get("affectedServices").get(0).get("serviceName").asText());
        assertEquals(1, report.get("dependencyGraph").get("metadata").get("criticalDependencyCount").asInt());
    }

    @Test
    void shouldMapFailuresToExitCodes() {
        assertEquals(2, run("--mode", "track").exitCode());
        assertEquals(2, run("--mode", "register_dependency", "--target", "a.proto", "--service", "s",
                "--strength", "fierce").exitCode());
        assertEquals(1, run("--mode", "status", "--review-id", "missing").exitCode());
        assertEquals(1, run("--mode", "sync", "--change-id", "missing").exitCode());
    }

    private Result run(String... args) {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new StubbedMain());
        commandLine.setOut(new PrintWriter(out));
        List<String> arguments = new ArrayList<>(List.of("--config", configPath.toString(),
                "--storage-dir", tempDir.resolve("storage").toString()));
        arguments.addAll(List.of(args));
        int exitCode = commandLine.execute(arguments.toArray(new String[0]));
        return new Result(exitCode, out.toString());
    }

    private record Result(int exitCode, String output) {
    }

    private class StubbedMain extends Main {
        @Override
        BreakingChangeClassifier createClassifier(GovernanceConfig config) {
            return (target, baseline) -> {
                detectedTargets.add(target);
                return List.of();
            };
        }
    }
}
