package com.lifecycle.core.service.policy;

import java.time.Instant;

/**
 * Common shape of retention and archive policies as seen by {@link PolicyStore}.
 *
 * @param <P> the concrete policy type
 */
public interface LifecyclePolicy<P extends LifecyclePolicy<P>> {

    String getId();

    void setId(String id);

    String getName();

    boolean isEnabled();

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    void setUpdatedAt(Instant updatedAt);

    /**
     * Deep copy, so stored instances are never shared with callers.
     */
    P copy();
}
