package com.schemagov;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.schemagov.dependency.DependencyAnalysisException;
import com.schemagov.dependency.DependencyGraph;
import com.schemagov.dependency.DependencyKind;
import com.schemagov.dependency.DependencyRegistry;
import com.schemagov.dependency.DependencyStrength;
import com.schemagov.dependency.ServiceDependency;
import com.schemagov.dependency.ServiceInfo;
import com.schemagov.dependency.UsagePattern;
import com.schemagov.detect.BreakingChange;
import com.schemagov.detect.BreakingChangeClassifier;
import com.schemagov.detect.BreakingChangeDetectionException;
import com.schemagov.detect.BufBreakingChangeClassifier;
import com.schemagov.detect.BufCliRunner;
import com.schemagov.detect.TimeBoundedClassifier;
import com.schemagov.governance.ApprovalLedger;
import com.schemagov.governance.BreakingChangeApproval;
import com.schemagov.governance.ChangeApprovals;
import com.schemagov.governance.ChangeKind;
import com.schemagov.governance.ComplianceReporter;
import com.schemagov.governance.GovernanceException;
import com.schemagov.governance.GovernancePolicyEnforcer;
import com.schemagov.governance.GovernanceService;
import com.schemagov.governance.PolicyStore;
import com.schemagov.governance.SchemaChange;
import com.schemagov.impact.CrossSystemImpact;
import com.schemagov.impact.ImpactAnalyzer;
import com.schemagov.impact.MigrationGuideRenderer;
import com.schemagov.impact.MigrationPlanStore;
import com.schemagov.impact.MigrationPlanner;
import com.schemagov.impact.ServiceImpact;
import com.schemagov.impact.TeamImpact;
import com.schemagov.notify.LoggingNotifier;
import com.schemagov.notify.Notifier;
import com.schemagov.notify.WebhookNotifier;
import com.schemagov.review.CommentType;
import com.schemagov.review.ReviewRequest;
import com.schemagov.review.ReviewWorkflowEngine;
import com.schemagov.review.ReviewWorkflowException;
import com.schemagov.runtime.ConfigurationException;
import com.schemagov.runtime.GovernanceConfig;
import com.schemagov.runtime.GovernanceConfigLoader;
import com.schemagov.store.JsonFileVersionedStore;
import com.schemagov.store.JsonLinesAuditTrail;
import com.schemagov.team.ConfiguredTeamDirectory;
import com.schemagov.tracking.ChangeHistoryQuery;
import com.schemagov.tracking.ChangeRecord;
import com.schemagov.tracking.ChangeTracker;
import com.schemagov.tracking.ChangeTrackingException;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "schema-governance",
        mixinStandardHelpOptions = true,
        version = "schema-governance 0.1.0",
        description = "Tracks schema changes, enforces review and breaking change policies, and plans migrations.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML governance config", defaultValue = "src/main/resources/governance.yml")
    String configPath;

    @Option(names = "--mode", required = true, description = "Operation: ${COMPLETION-CANDIDATES}")
    Mode mode;

    @Option(names = "--storage-dir", description = "Overrides global_settings.storage_dir")
    Path storageDir;

    @Option(names = "--target", description = "Schema target, e.g. acme/payments/v1/payment.proto")
    String target;

    @Option(names = "--repository", description = "Repository the schema lives in")
    String repository;

    @Option(names = "--kind", description = "Change kind: addition, modification or removal", defaultValue = "modification")
    String kind;

    @Option(names = "--author", description = "Author of the change or actor of a review action")
    String author;

    @Option(names = "--owning-team", description = "Team owning the schema")
    String owningTeam;

    @Option(names = "--affected-team", description = "Team affected by the change (repeatable)")
    List<String> affectedTeams = new ArrayList<>();

    @Option(names = "--breaking", description = "Declare the change as breaking", defaultValue = "false")
    boolean breaking;

    @Option(names = "--description", description = "Free text description")
    String description;

    @Option(names = "--baseline", description = "Baseline ref breaking changes are detected against")
    String baseline;

    @Option(names = "--breaking-changes-file", description = "JSON file holding a list of breaking changes")
    Path breakingChangesFile;

    @Option(names = "--change-id", description = "Tracked change id")
    String changeId;

    @Option(names = "--review-id", description = "Review request id")
    String reviewId;

    @Option(names = "--reviewer", description = "Reviewer username")
    String reviewer;

    @Option(names = "--comment", description = "Comment or reason attached to a review action")
    String comment;

    @Option(names = "--service", description = "Service name")
    String service;

    @Option(names = "--system", description = "System the service belongs to")
    String system;

    @Option(names = "--strength", description = "Dependency strength: weak, medium, strong or critical", defaultValue = "medium")
    String strength;

    @Option(names = "--dependency-kind", description = "Dependency kind: direct, transitive or optional", defaultValue = "direct")
    String dependencyKind;

    @Option(names = "--usage", description = "Usage pattern: consumer, producer or both", defaultValue = "consumer")
    String usage;

    @Option(names = "--policy", description = "Breaking change policy to apply instead of the configured one")
    String policy;

    @Option(names = "--location", description = "Breaking change location (path:line)")
    String location;

    @Option(names = "--timeframe", description = "Report window such as 1d, 7d or 30d", defaultValue = "7d")
    String timeframe;

    @Option(names = "--team", description = "Team filter for history")
    String team;

    @Option(names = "--limit", description = "Maximum history entries", defaultValue = "50")
    int limit;

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private final Clock clock = Clock.systemUTC();
    private OkHttpClient httpClient;

    enum Mode {
        track,
        approve,
        reject,
        cancel,
        comment,
        status,
        pending,
        sync,
        history,
        register_dependency,
        register_service,
        analyze,
        migration_plan,
        migration_guide,
        check_policy,
        record_approval,
        approve_breaking,
        compliance_report,
        change_report
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        GovernanceConfig config = new GovernanceConfigLoader().load(Path.of(configPath));
        Path storage = storageDir != null ? storageDir : Path.of(config.getSchemaGovernance().getGlobalSettings().getStorageDir());
        log.info("Starting schema governance mode={} config={} storage={}", mode, configPath, storage);

        try {
            Components components = wire(config, storage);
            Object result = run(components);
            if (result == null) {
                return 2;
            }
            PrintWriter out = spec.commandLine().getOut();
            out.println(result instanceof String text ? text : mapper.writeValueAsString(result));
            out.flush();
            return 0;
        } catch (ConfigurationException | GovernanceException | ReviewWorkflowException | ChangeTrackingException
                | BreakingChangeDetectionException | DependencyAnalysisException e) {
            log.error("{} failed: {}", mode, e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments for {}: {}", mode, e.getMessage());
            return 2;
        } finally {
            shutdownHttpClient();
        }
    }

    private Object run(Components c) throws IOException {
        return switch (mode) {
            case track -> {
                if (missing("--target", target)) {
                    yield null;
                }
                ChangeKind changeKind = ChangeKind.fromValue(kind);
                SchemaChange change = changeId == null
                        ? SchemaChange.propose(target, changeKind, author, repository, owningTeam, affectedTeams, breaking, description, clock)
                        : new SchemaChange(changeId, target, changeKind, author, repository, owningTeam, affectedTeams, breaking,
                                description, clock.instant());
                yield c.tracker().trackSchemaChange(change, baseline);
            }
            case approve -> {
                if (missing("--review-id", reviewId) || missing("--reviewer", reviewer)) {
                    yield null;
                }
                boolean recorded = c.reviews().approve(reviewId, reviewer, comment);
                if (!recorded) {
                    log.info("Reviewer {} had already approved review {}", reviewer, reviewId);
                }
                yield c.reviews().checkApprovalStatus(reviewId);
            }
            case reject -> {
                if (missing("--review-id", reviewId) || missing("--reviewer", reviewer)) {
                    yield null;
                }
                yield c.reviews().reject(reviewId, reviewer, comment);
            }
            case cancel -> {
                if (missing("--review-id", reviewId) || missing("--author", author)) {
                    yield null;
                }
                yield c.reviews().cancel(reviewId, author, comment);
            }
            case comment -> {
                if (missing("--review-id", reviewId) || missing("--author", author) || missing("--comment", comment)) {
                    yield null;
                }
                yield c.reviews().addComment(reviewId, author, comment, CommentType.GENERAL);
            }
            case status -> {
                if (missing("--review-id", reviewId)) {
                    yield null;
                }
                yield c.reviews().checkApprovalStatus(reviewId);
            }
            case pending -> c.reviews().listPendingReviews(reviewer);
            case sync -> {
                if (missing("--change-id", changeId)) {
                    yield null;
                }
                yield c.tracker().syncReviewStatus(changeId);
            }
            case history -> c.tracker().getChangeHistory(new ChangeHistoryQuery(target, team, null, limit));
            case register_dependency -> {
                if (missing("--target", target) || missing("--service", service)) {
                    yield null;
                }
                ServiceDependency dependency = new ServiceDependency(
                        service,
                        repository,
                        DependencyKind.fromValue(dependencyKind),
                        UsagePattern.fromValue(usage),
                        DependencyStrength.fromValue(strength),
                        owningTeam,
                        null);
                c.registry().registerServiceDependency(target, dependency);
                yield c.registry().requireDependency(target, service);
            }
            case register_service -> {
                if (missing("--service", service)) {
                    yield null;
                }
                ServiceInfo info = new ServiceInfo(service, system, description, owningTeam);
                c.registry().registerService(info);
                yield info;
            }
            case analyze -> {
                if (missing("--target", target)) {
                    yield null;
                }
                List<BreakingChange> changes = breakingChanges(c);
                yield new ImpactReport(
                        c.analyzer().dependencyGraph(target),
                        c.analyzer().identifyAffectedServices(target, changes),
                        c.analyzer().analyzeTeamImpacts(target, changes),
                        c.analyzer().analyzeCrossSystemImpact(target, changes),
                        c.analyzer().migrationRecommendations(target));
            }
            case migration_plan -> {
                if (missing("--change-id", changeId) || missing("--target", target)) {
                    yield null;
                }
                yield c.planner().generateMigrationPlan(changeId, target, breakingChanges(c));
            }
            case migration_guide -> {
                if (missing("--target", target)) {
                    yield null;
                }
                yield new MigrationGuideRenderer().render(target, breakingChanges(c));
            }
            case check_policy -> {
                if (changeId != null) {
                    Optional<ChangeRecord> record = c.tracker().getChange(changeId);
                    if (record.isEmpty()) {
                        throw new ChangeTrackingException("Change " + changeId + " not found");
                    }
                    yield c.governance().enforceReviewPolicy(record.get().change());
                }
                yield c.governance().enforceBreakingChangePolicy(breakingChanges(c), policy);
            }
            case record_approval -> {
                if (missing("--change-id", changeId) || missing("--reviewer", reviewer)) {
                    yield null;
                }
                yield c.governance().recordChangeApproval(changeId, reviewer, target);
            }
            case approve_breaking -> {
                if (missing("--reviewer", reviewer)) {
                    yield null;
                }
                if (location != null) {
                    boolean recorded = c.governance().recordBreakingChangeApproval(repository, location, reviewer, target);
                    yield new ApprovalOutcome(BreakingChangeApproval.key(repository, location), recorded ? 1 : 0);
                }
                List<BreakingChange> changes = breakingChanges(c);
                yield new ApprovalOutcome(target, c.governance().approveBreakingChanges(changes, reviewer, target));
            }
            case compliance_report -> c.compliance().generate(timeframe);
            case change_report -> c.tracker().generateChangeReport(timeframe);
        };
    }

    private boolean missing(String option, String value) {
        if (value == null || value.isBlank()) {
            log.error("{} is required in {} mode", option, mode);
            return true;
        }
        return false;
    }

    /**
     * Breaking changes come from {@code --breaking-changes-file} when given, otherwise from running the classifier
     * against {@code --baseline}. With neither, the list is empty.
     */
    private List<BreakingChange> breakingChanges(Components c) throws IOException {
        if (breakingChangesFile != null) {
            if (!Files.exists(breakingChangesFile)) {
                throw new IllegalArgumentException("Breaking changes file not found: " + breakingChangesFile);
            }
            return mapper.readValue(breakingChangesFile.toFile(), new TypeReference<List<BreakingChange>>() {
            });
        }
        if (baseline != null && target != null) {
            return c.classifier().detect(target, baseline).stream()
                    .map(change -> change.withRepository(repository))
                    .toList();
        }
        return List.of();
    }

    Components wire(GovernanceConfig config, Path storage) throws IOException {
        PolicyStore policyStore = new PolicyStore(config);
        ConfiguredTeamDirectory teams = new ConfiguredTeamDirectory(config);
        Notifier notifier = createNotifier(policyStore);

        JsonLinesAuditTrail auditTrail = new JsonLinesAuditTrail(storage.resolve("audit.jsonl"));
        ApprovalLedger ledger = new ApprovalLedger(
                new JsonFileVersionedStore<>(storage.resolve("change-approvals.json"), ChangeApprovals.class),
                new JsonFileVersionedStore<>(storage.resolve("breaking-approvals.json"), BreakingChangeApproval.class));
        GovernanceService governance = new GovernanceService(
                new GovernancePolicyEnforcer(policyStore, teams, ledger), ledger, auditTrail);

        DependencyRegistry registry = new DependencyRegistry(storage.resolve("dependencies.json"));
        ImpactAnalyzer analyzer = new ImpactAnalyzer(registry);
        MigrationPlanner planner = new MigrationPlanner(analyzer, new MigrationPlanStore(storage.resolve("migration-plans")));
        ReviewWorkflowEngine reviews = new ReviewWorkflowEngine(
                new JsonFileVersionedStore<>(storage.resolve("reviews.json"), ReviewRequest.class), teams, notifier);
        BreakingChangeClassifier classifier = createClassifier(config);
        ChangeTracker tracker = new ChangeTracker(
                new JsonFileVersionedStore<>(storage.resolve("changes.json"), ChangeRecord.class),
                auditTrail,
                classifier,
                analyzer,
                governance,
                reviews,
                teams,
                policyStore,
                notifier);
        return new Components(governance, registry, analyzer, planner, reviews, tracker, classifier,
                new ComplianceReporter(auditTrail));
    }

    BreakingChangeClassifier createClassifier(GovernanceConfig config) {
        GovernanceConfig.DetectorConfig detector = config.getDetector();
        Duration timeout = Duration.ofSeconds(detector.getTimeoutSeconds());
        return new TimeBoundedClassifier(
                new BufBreakingChangeClassifier(new BufCliRunner(timeout), detector.getBufPath(), Path.of(".")),
                timeout);
    }

    Notifier createNotifier(PolicyStore policyStore) {
        if (policyStore.webhooks().isEmpty()) {
            return new LoggingNotifier();
        }
        httpClient = new OkHttpClient();
        return new WebhookNotifier(httpClient, policyStore.webhooks(), new LoggingNotifier());
    }

    private void shutdownHttpClient() {
        if (httpClient == null) {
            return;
        }
        httpClient.dispatcher().executorService().shutdown();
        try {
            if (!httpClient.dispatcher().executorService().awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Webhook deliveries still in flight at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        httpClient.connectionPool().evictAll();
    }

    record Components(
            GovernanceService governance,
            DependencyRegistry registry,
            ImpactAnalyzer analyzer,
            MigrationPlanner planner,
            ReviewWorkflowEngine reviews,
            ChangeTracker tracker,
            BreakingChangeClassifier classifier,
            ComplianceReporter compliance) {
    }

    record ImpactReport(
            DependencyGraph dependencyGraph,
            List<ServiceImpact> affectedServices,
            List<TeamImpact> teamImpacts,
            CrossSystemImpact crossSystemImpact,
            List<String> recommendations) {
    }

    record ApprovalOutcome(String subject, int newlyApproved) {
    }
}
