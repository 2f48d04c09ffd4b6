package com.lifecycle.core.service.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifecycle.core.service.cleanup.CleanupManager;
import com.lifecycle.core.service.exception.NotFoundException;
import com.lifecycle.core.service.persistence.InMemoryRecordStore;
import com.lifecycle.core.service.persistence.JsonFileRecordStore;
import com.lifecycle.core.service.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private PolicyStore<RetentionPolicy> store;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC);
        store = new PolicyStore<>("Retention", new InMemoryRecordStore<>("policies", RetentionPolicy::getId),
                DefaultPolicies::retentionPolicies, CleanupManager::validatePolicy, clock);
    }

    @Test
    void defaultsAreSeededOnceAcrossRestarts() {
        Path file = tempDir.resolve("retention-policies.json");

        var first = fileStore(file);
        assertThat(first.seedDefaults()).isEqualTo(3);
        assertThat(first.seedDefaults()).isZero();

        var restarted = fileStore(file);
        assertThat(restarted.seedDefaults()).isZero();
        assertThat(restarted.list()).extracting(RetentionPolicy::getId)
                .containsExactlyInAnyOrder("test_results_policy", "logs_policy", "temp_files_policy");

        RetentionPolicy testResults = restarted.get("test_results_policy").orElseThrow();
        CleanupRule archiveRule = testResults.getRules().get(0);
        assertThat(archiveRule.getAction()).isEqualTo(LifecycleAction.ARCHIVE);
        assertThat(archiveRule.getParameters()).containsEntry("compressionLevel", 6);
    }

    @Test
    void seedingSkipsNonEmptyStore() {
        store.create(policy("custom"));

        assertThat(store.seedDefaults()).isZero();
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void createGeneratesIdAndTimestamps() {
        String id = store.create(policy("generated"));

        RetentionPolicy stored = store.get(id).orElseThrow();
        assertThat(id).startsWith("policy_");
        assertThat(stored.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(stored.getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void returnedPoliciesAreIsolatedFromStore() {
        String id = store.create(policy("isolated"));

        RetentionPolicy copy = store.get(id).orElseThrow();
        copy.setRetentionDays(1);
        copy.getDataTypes().add("temp");
        copy.getRules().get(0).getParameters().put("target", "/elsewhere");

        RetentionPolicy stored = store.get(id).orElseThrow();
        assertThat(stored.getRetentionDays()).isEqualTo(30);
        assertThat(stored.getDataTypes()).containsExactly("logs");
        assertThat(stored.getRules().get(0).getParameters()).isEmpty();
    }

    @Test
    void updateAppliesPatchAndKeepsCreationTime() {
        String id = store.create(policy("patched"));
        Instant created = clock.instant();
        clock.advance(Duration.ofMinutes(5));

        RetentionPolicy updated = store.update(id, p -> {
            p.setRetentionDays(14);
            p.setId("ignored");
            return p;
        });

        assertThat(updated.getId()).isEqualTo(id);
        assertThat(updated.getRetentionDays()).isEqualTo(14);
        assertThat(updated.getCreatedAt()).isEqualTo(created);
        assertThat(updated.getUpdatedAt()).isEqualTo(clock.instant());
        assertThat(store.get("ignored")).isEmpty();
    }

    @Test
    void updateOfMissingPolicyIsNotFound() {
        assertThatThrownBy(() -> store.update("nope", p -> p))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void rejectedPatchLeavesPolicyUnchanged() {
        String id = store.create(policy("valid"));

        assertThatThrownBy(() -> store.update(id, p -> {
            p.setRetentionDays(-3);
            return p;
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(store.get(id).orElseThrow().getRetentionDays()).isEqualTo(30);
    }

    @Test
    void invalidPolicyIsNeverStored() {
        var moveWithoutTarget = policy("move");
        moveWithoutTarget.setRules(List.of(CleanupRule.builder().id("m").action(LifecycleAction.MOVE).build()));

        assertThatThrownBy(() -> store.create(moveWithoutTarget)).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    void listIsInCreationOrderAndDeleteRemoves() {
        String first = store.create(policy("first"));
        clock.advance(Duration.ofSeconds(1));
        String second = store.create(policy("second"));

        assertThat(store.list()).extracting(RetentionPolicy::getId).containsExactly(first, second);
        assertThat(store.delete(first)).isTrue();
        assertThat(store.delete(first)).isFalse();
        assertThat(store.list()).extracting(RetentionPolicy::getId).containsExactly(second);
    }

    private PolicyStore<RetentionPolicy> fileStore(Path file) {
        return new PolicyStore<>("Retention",
                new JsonFileRecordStore<>(file, RetentionPolicy.class, RetentionPolicy::getId, objectMapper),
                DefaultPolicies::retentionPolicies, CleanupManager::validatePolicy, clock);
    }

    private static RetentionPolicy policy(String name) {
        return RetentionPolicy.builder()
                .name(name)
                .dataTypes(new ArrayList<>(List.of("logs")))
                .retentionDays(30)
                .rules(new ArrayList<>(List.of(CleanupRule.builder()
                        .id("delete")
                        .action(LifecycleAction.DELETE)
                        .parameters(new HashMap<>())
                        .build())))
                .build();
    }
}
