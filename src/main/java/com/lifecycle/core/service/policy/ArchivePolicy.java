package com.lifecycle.core.service.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cron-scheduled list of archival rules. The schedule must parse before the policy can be enabled.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchivePolicy implements LifecyclePolicy<ArchivePolicy> {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private List<ArchiveRule> rules = new ArrayList<>();

    private String schedule;
    private boolean enabled;

    private Instant createdAt;
    private Instant updatedAt;

    public List<ArchiveRule> orderedRules() {
        return rules.stream()
                .filter(ArchiveRule::isEnabled)
                .sorted(Comparator.comparingInt(ArchiveRule::getPriority))
                .toList();
    }

    @Override
    public ArchivePolicy copy() {
        return toBuilder()
                .rules(new ArrayList<>(rules.stream().map(rule -> rule.toBuilder().build()).toList()))
                .build();
    }
}
