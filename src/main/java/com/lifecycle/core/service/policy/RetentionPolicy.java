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
 * Rule set deciding when data of the listed types becomes eligible for a lifecycle action.
 *
 * Items older than {@code retentionDays}, or beyond the newest {@code maxCount} items of a
 * data type, are candidates. Each candidate gets the action of the first enabled rule
 * (ascending priority) whose condition matches.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetentionPolicy implements LifecyclePolicy<RetentionPolicy> {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private List<String> dataTypes = new ArrayList<>();

    private int retentionDays;

    /**
     * Maximum number of items kept per data type (null or 0 = unlimited).
     */
    private Integer maxCount;

    @Builder.Default
    private List<CleanupRule> rules = new ArrayList<>();

    private int priority;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Enabled rules in evaluation order.
     */
    public List<CleanupRule> orderedRules() {
        return rules.stream()
                .filter(CleanupRule::isEnabled)
                .sorted(Comparator.comparingInt(CleanupRule::getPriority))
                .toList();
    }

    @Override
    public RetentionPolicy copy() {
        return toBuilder()
                .dataTypes(new ArrayList<>(dataTypes))
                .rules(new ArrayList<>(rules.stream().map(CleanupRule::copy).toList()))
                .build();
    }
}
