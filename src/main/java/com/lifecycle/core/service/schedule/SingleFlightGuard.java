package com.lifecycle.core.service.schedule;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allows at most one run of a recurring operation at a time. Overlapping invocations are
 * skipped, never queued.
 */
@Slf4j
public class SingleFlightGuard {

    private final String name;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong skipped = new AtomicLong();

    public SingleFlightGuard(String name) {
        this.name = name;
    }

    /**
     * Runs the task unless another run holds the guard.
     *
     * @return true if the task ran, false if it was skipped
     */
    public boolean runExclusive(Runnable task) {
        if (!running.compareAndSet(false, true)) {
            skipped.incrementAndGet();
            log.info("{} run skipped: previous run still in progress", name);
            return false;
        }
        try {
            task.run();
            return true;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getSkippedCount() {
        return skipped.get();
    }

    public String getName() {
        return name;
    }
}
