package com.schemagov.governance;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.schemagov.review.Reviewer;
import com.schemagov.runtime.ConfigurationException;
import com.schemagov.runtime.GovernanceConfig;

/**
 * Read-only view over the governance configuration that resolves which policy applies to a repository or team.
 */
public class PolicyStore {
    public static final String DEFAULT_POLICY = "default";

    private final GovernanceConfig config;

    public PolicyStore(GovernanceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GovernanceConfig config() {
        return config;
    }

    /**
     * Resolution order: exact repository key, {@code org/repo} suffix of the repository, the team override, then
     * {@code default}.
     */
    public String reviewPolicyKeyFor(String repository, String owningTeam) {
        Map<String, GovernanceConfig.ReviewPolicyConfig> policies = governance().getReviewPolicies();
        if (repository != null && !repository.isBlank()) {
            if (policies.containsKey(repository)) {
                return repository;
            }
            String shortName = shortRepositoryName(repository);
            if (shortName != null && policies.containsKey(shortName)) {
                return shortName;
            }
        }
        if (owningTeam != null) {
            GovernanceConfig.TeamOverrideConfig override = governance().getTeamOverrides().get(owningTeam);
            if (override != null && override.getReviewPolicy() != null && !override.getReviewPolicy().isBlank()) {
                return override.getReviewPolicy();
            }
        }
        return DEFAULT_POLICY;
    }

    public ReviewPolicy reviewPolicyFor(String repository, String owningTeam) {
        String key = reviewPolicyKeyFor(repository, owningTeam);
        GovernanceConfig.ReviewPolicyConfig policy = governance().getReviewPolicies().get(key);
        if (policy == null) {
            if (DEFAULT_POLICY.equals(key)) {
                return ReviewPolicy.builtInDefault();
            }
            throw new ConfigurationException("Review policy '" + key + "' referenced for team " + owningTeam + " is not defined");
        }
        if (policy.getApprovalCount() < 1) {
            throw new ConfigurationException("Review policy '" + key + "' must require at least one approval");
        }
        List<Reviewer> reviewers = new ArrayList<>();
        for (String raw : policy.getRequiredReviewers()) {
            if (raw == null || raw.isBlank() || Reviewer.TEAM_PREFIX.equals(raw.trim())) {
                throw new ConfigurationException("Review policy '" + key + "' lists a blank reviewer");
            }
            reviewers.add(Reviewer.parse(raw));
        }
        return new ReviewPolicy(key, reviewers, policy.getApprovalCount(), policy.isAutoApproveMinor());
    }

    /**
     * Resolution order: repository key, {@code org/repo} suffix, {@code default} key, then the global default.
     */
    public BreakingChangePolicy breakingChangePolicyFor(String repository) {
        Map<String, String> policies = governance().getBreakingChangePolicies();
        String raw = null;
        if (repository != null && !repository.isBlank()) {
            raw = policies.get(repository);
            if (raw == null) {
                String shortName = shortRepositoryName(repository);
                raw = shortName == null ? null : policies.get(shortName);
            }
        }
        if (raw == null) {
            raw = policies.get(DEFAULT_POLICY);
        }
        if (raw == null) {
            raw = governance().getGlobalSettings().getDefaultBreakingChangePolicy();
        }
        return BreakingChangePolicy.fromValue(raw);
    }

    public boolean requiresReviewForAllChanges(String team) {
        if (team == null) {
            return false;
        }
        GovernanceConfig.TeamOverrideConfig override = governance().getTeamOverrides().get(team);
        return override != null && override.isRequireReviewAllChanges();
    }

    public Map<String, List<String>> webhooks() {
        return governance().getNotificationSettings().getWebhooks();
    }

    public List<String> notificationChannels() {
        return governance().getNotificationSettings().getDefaultChannels();
    }

    private GovernanceConfig.SchemaGovernanceConfig governance() {
        return config.getSchemaGovernance();
    }

    /**
     * Last two path segments of a repository reference, e.g. {@code buf.build/acme/payments} becomes
     * {@code acme/payments}.
     */
    static String shortRepositoryName(String repository) {
        String trimmed = repository.trim();
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        List<String> segments = new ArrayList<>();
        for (String segment : trimmed.split("[/:]")) {
            if (!segment.isBlank()) {
                segments.add(segment);
            }
        }
        if (segments.size() < 2) {
            return null;
        }
        return segments.get(segments.size() - 2) + "/" + segments.get(segments.size() - 1);
    }
}
