package com.schemagov.team;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.schemagov.runtime.GovernanceConfig;

/**
 * Team directory backed by the {@code teams} section of the governance configuration.
 */
public class ConfiguredTeamDirectory implements TeamDirectory {
    private final Map<String, GovernanceConfig.TeamConfig> teams;

    public ConfiguredTeamDirectory(GovernanceConfig config) {
        this(Objects.requireNonNull(config, "config").getTeams());
    }

    public ConfiguredTeamDirectory(Map<String, GovernanceConfig.TeamConfig> teams) {
        this.teams = teams == null ? Map.of() : new LinkedHashMap<>(teams);
    }

    @Override
    public List<TeamMember> resolveTeam(String name) {
        GovernanceConfig.TeamConfig team = teams.get(name);
        if (team == null) {
            return List.of();
        }
        return team.getMembers().stream()
                .filter(member -> member.getUsername() != null && !member.getUsername().isBlank())
                .map(member -> new TeamMember(member.getUsername(), member.getRole()))
                .toList();
    }

    @Override
    public Optional<String> owningTeamOf(String repository) {
        if (repository == null || repository.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<String, GovernanceConfig.TeamConfig> entry : teams.entrySet()) {
            if (entry.getValue().getRepositories().contains(repository)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    @Override
    public TeamSettings settings(String team) {
        GovernanceConfig.TeamConfig config = team == null ? null : teams.get(team);
        if (config == null) {
            return TeamSettings.defaults();
        }
        return new TeamSettings(config.getSettings().isRequireReviewAllChanges());
    }
}
