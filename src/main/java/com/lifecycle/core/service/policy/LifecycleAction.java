package com.lifecycle.core.service.policy;

/**
 * Actions a lifecycle rule can apply to a stale item.
 */
public enum LifecycleAction {
    DELETE,
    ARCHIVE,
    COMPRESS,
    MOVE
}
