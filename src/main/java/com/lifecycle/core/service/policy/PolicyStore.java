package com.lifecycle.core.service.policy;

import com.lifecycle.core.service.exception.NotFoundException;
import com.lifecycle.core.service.job.JobIds;
import com.lifecycle.core.service.persistence.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Durable registry of lifecycle policies.
 *
 * Seeds a fixed set of defaults only when the backing store is empty, so restarts
 * never duplicate them. A validator runs against every created or patched policy
 * before anything is written.
 *
 * @param <P> the policy type
 */
@Slf4j
public class PolicyStore<P extends LifecyclePolicy<P>> {

    private final String kind;
    private final RecordStore<P> store;
    private final Supplier<List<P>> defaults;
    private final Consumer<P> validator;
    private final Clock clock;

    public PolicyStore(String kind, RecordStore<P> store, Supplier<List<P>> defaults,
                       Consumer<P> validator, Clock clock) {
        this.kind = kind;
        this.store = store;
        this.defaults = defaults;
        this.validator = validator != null ? validator : policy -> { };
        this.clock = clock;
    }

    /**
     * Inserts the default policies if, and only if, the store holds no policies.
     *
     * @return number of policies seeded
     */
    public synchronized int seedDefaults() {
        if (store.count() > 0) {
            log.debug("{} store already holds {} policies, skipping seeding", kind, store.count());
            return 0;
        }
        List<P> seeds = defaults.get();
        seeds.forEach(this::create);
        log.info("Seeded {} default {} policies", seeds.size(), kind);
        return seeds.size();
    }

    /**
     * Stores a new policy. A caller-supplied id is kept, otherwise one is generated.
     *
     * @return the policy id
     */
    public String create(P policy) {
        var record = policy.copy();
        if (record.getId() == null || record.getId().isBlank()) {
            record.setId(JobIds.next("policy", clock));
        }
        Instant now = clock.instant();
        record.setCreatedAt(now);
        record.setUpdatedAt(now);

        validator.accept(record);
        store.insert(record);
        log.info("{} policy created: {} ({})", kind, record.getId(), record.getName());
        return record.getId();
    }

    public Optional<P> get(String policyId) {
        return store.findById(policyId).map(LifecyclePolicy::copy);
    }

    /**
     * Lists policies in creation order.
     */
    public List<P> list() {
        return store.findAll().stream()
                .map(LifecyclePolicy::copy)
                .sorted(Comparator.comparing(LifecyclePolicy::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Applies a patch to a copy of the stored policy and writes the result.
     *
     * @throws NotFoundException if no policy has the given id
     */
    public synchronized P update(String policyId, UnaryOperator<P> patch) {
        P existing = store.findById(policyId)
                .orElseThrow(() -> new NotFoundException(kind + " policy", policyId));

        P updated = patch.apply(existing.copy());
        updated.setId(policyId);
        updated.setCreatedAt(existing.getCreatedAt());
        updated.setUpdatedAt(clock.instant());

        validator.accept(updated);
        store.upsert(updated);
        log.info("{} policy updated: {}", kind, policyId);
        return updated.copy();
    }

    public boolean delete(String policyId) {
        boolean deleted = store.delete(policyId);
        if (deleted) {
            log.info("{} policy deleted: {}", kind, policyId);
        }
        return deleted;
    }

    public int count() {
        return store.count();
    }
}
