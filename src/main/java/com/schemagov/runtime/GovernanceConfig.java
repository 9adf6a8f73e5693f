package com.schemagov.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.schemagov.team.TeamRole;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GovernanceConfig {
    private SchemaGovernanceConfig schemaGovernance = new SchemaGovernanceConfig();
    private Map<String, TeamConfig> teams = new LinkedHashMap<>();
    private DetectorConfig detector = new DetectorConfig();

    public SchemaGovernanceConfig getSchemaGovernance() {
        return schemaGovernance;
    }

    public void setSchemaGovernance(SchemaGovernanceConfig schemaGovernance) {
        this.schemaGovernance = schemaGovernance == null ? new SchemaGovernanceConfig() : schemaGovernance;
    }

    public Map<String, TeamConfig> getTeams() {
        return teams;
    }

    public void setTeams(Map<String, TeamConfig> teams) {
        this.teams = teams == null ? new LinkedHashMap<>() : teams;
    }

    public DetectorConfig getDetector() {
        return detector;
    }

    public void setDetector(DetectorConfig detector) {
        this.detector = detector == null ? new DetectorConfig() : detector;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchemaGovernanceConfig {
        private Map<String, ReviewPolicyConfig> reviewPolicies = new LinkedHashMap<>();
        private Map<String, String> breakingChangePolicies = new LinkedHashMap<>();
        private Map<String, TeamOverrideConfig> teamOverrides = new LinkedHashMap<>();
        private NotificationSettings notificationSettings = new NotificationSettings();
        private GlobalSettings globalSettings = new GlobalSettings();

        public Map<String, ReviewPolicyConfig> getReviewPolicies() {
            return reviewPolicies;
        }

        public void setReviewPolicies(Map<String, ReviewPolicyConfig> reviewPolicies) {
            this.reviewPolicies = reviewPolicies == null ? new LinkedHashMap<>() : reviewPolicies;
        }

        public Map<String, String> getBreakingChangePolicies() {
            return breakingChangePolicies;
        }

        public void setBreakingChangePolicies(Map<String, String> breakingChangePolicies) {
            this.breakingChangePolicies = breakingChangePolicies == null ? new LinkedHashMap<>() : breakingChangePolicies;
        }

        public Map<String, TeamOverrideConfig> getTeamOverrides() {
            return teamOverrides;
        }

        public void setTeamOverrides(Map<String, TeamOverrideConfig> teamOverrides) {
            this.teamOverrides = teamOverrides == null ? new LinkedHashMap<>() : teamOverrides;
        }

        public NotificationSettings getNotificationSettings() {
            return notificationSettings;
        }

        public void setNotificationSettings(NotificationSettings notificationSettings) {
            this.notificationSettings = notificationSettings == null ? new NotificationSettings() : notificationSettings;
        }

        public GlobalSettings getGlobalSettings() {
            return globalSettings;
        }

        public void setGlobalSettings(GlobalSettings globalSettings) {
            this.globalSettings = globalSettings == null ? new GlobalSettings() : globalSettings;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReviewPolicyConfig {
        private List<String> requiredReviewers = new ArrayList<>();
        private int approvalCount = 1;
        private boolean autoApproveMinor = false;

        public List<String> getRequiredReviewers() {
            return requiredReviewers;
        }

        public void setRequiredReviewers(List<String> requiredReviewers) {
            this.requiredReviewers = requiredReviewers == null ? new ArrayList<>() : requiredReviewers;
        }

        public int getApprovalCount() {
            return approvalCount;
        }

        public void setApprovalCount(int approvalCount) {
            this.approvalCount = approvalCount;
        }

        public boolean isAutoApproveMinor() {
            return autoApproveMinor;
        }

        public void setAutoApproveMinor(boolean autoApproveMinor) {
            this.autoApproveMinor = autoApproveMinor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TeamOverrideConfig {
        private String reviewPolicy;
        private boolean requireReviewAllChanges = false;

        public String getReviewPolicy() {
            return reviewPolicy;
        }

        public void setReviewPolicy(String reviewPolicy) {
            this.reviewPolicy = reviewPolicy;
        }

        public boolean isRequireReviewAllChanges() {
            return requireReviewAllChanges;
        }

        public void setRequireReviewAllChanges(boolean requireReviewAllChanges) {
            this.requireReviewAllChanges = requireReviewAllChanges;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NotificationSettings {
        private List<String> defaultChannels = List.of("slack", "email");
        private Map<String, List<String>> webhooks = new LinkedHashMap<>();

        public List<String> getDefaultChannels() {
            return defaultChannels;
        }

        public void setDefaultChannels(List<String> defaultChannels) {
            this.defaultChannels = defaultChannels == null ? List.of("slack", "email") : defaultChannels;
        }

        public Map<String, List<String>> getWebhooks() {
            return webhooks;
        }

        public void setWebhooks(Map<String, List<String>> webhooks) {
            this.webhooks = webhooks == null ? new LinkedHashMap<>() : webhooks;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GlobalSettings {
        private String defaultBreakingChangePolicy = "error";
        private String storageDir = ".schema-governance";

        public String getDefaultBreakingChangePolicy() {
            return defaultBreakingChangePolicy;
        }

        public void setDefaultBreakingChangePolicy(String defaultBreakingChangePolicy) {
            this.defaultBreakingChangePolicy = defaultBreakingChangePolicy == null ? "error" : defaultBreakingChangePolicy;
        }

        public String getStorageDir() {
            return storageDir;
        }

        public void setStorageDir(String storageDir) {
            this.storageDir = storageDir == null ? ".schema-governance" : storageDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TeamConfig {
        private List<String> repositories = new ArrayList<>();
        private List<MemberConfig> members = new ArrayList<>();
        private TeamSettingsConfig settings = new TeamSettingsConfig();

        public List<String> getRepositories() {
            return repositories;
        }

        public void setRepositories(List<String> repositories) {
            this.repositories = repositories == null ? new ArrayList<>() : repositories;
        }

        public List<MemberConfig> getMembers() {
            return members;
        }

        public void setMembers(List<MemberConfig> members) {
            this.members = members == null ? new ArrayList<>() : members;
        }

        public TeamSettingsConfig getSettings() {
            return settings;
        }

        public void setSettings(TeamSettingsConfig settings) {
            this.settings = settings == null ? new TeamSettingsConfig() : settings;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MemberConfig {
        private String username;
        private TeamRole role = TeamRole.CONTRIBUTOR;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public TeamRole getRole() {
            return role;
        }

        public void setRole(TeamRole role) {
            this.role = role == null ? TeamRole.CONTRIBUTOR : role;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TeamSettingsConfig {
        private boolean requireReviewAllChanges = false;

        public boolean isRequireReviewAllChanges() {
            return requireReviewAllChanges;
        }

        public void setRequireReviewAllChanges(boolean requireReviewAllChanges) {
            this.requireReviewAllChanges = requireReviewAllChanges;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DetectorConfig {
        private String bufPath = "buf";
        private long timeoutSeconds = 60;

        public String getBufPath() {
            return bufPath;
        }

        public void setBufPath(String bufPath) {
            this.bufPath = bufPath == null ? "buf" : bufPath;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
