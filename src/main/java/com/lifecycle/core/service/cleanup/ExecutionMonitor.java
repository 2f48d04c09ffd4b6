package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.scan.StorageItem;

/**
 * Hooks the executing job into a batch: cooperative cancellation and per-item progress.
 */
public interface ExecutionMonitor {

    ExecutionMonitor NONE = new ExecutionMonitor() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public void itemCompleted(StorageItem item, boolean success) {
        }
    };

    /**
     * Checked between items; an item already in flight always completes.
     */
    boolean isCancelled();

    void itemCompleted(StorageItem item, boolean success);
}
