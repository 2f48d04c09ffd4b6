package com.lifecycle.core.service.schedule;

import com.lifecycle.core.service.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Cron registrations keyed by policy id.
 *
 * Each registration keeps its handle so it can be cancelled or replaced. {@link #trigger(String)}
 * runs a registered callback on the calling thread, without waiting for the clock.
 */
@Slf4j
public class PolicyScheduler {

    private final String name;
    private final TaskScheduler taskScheduler;
    private final ZoneId zone;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public PolicyScheduler(String name, TaskScheduler taskScheduler, ZoneId zone) {
        this.name = name;
        this.taskScheduler = taskScheduler;
        this.zone = zone;
    }

    /**
     * Registers (or replaces) the trigger for a policy. The expression is validated first;
     * on failure any existing registration is left untouched.
     *
     * @throws com.lifecycle.core.service.exception.InvalidScheduleException for a malformed expression
     */
    public void schedule(String policyId, String cronExpression, Runnable callback) {
        CronSchedules.validate(policyId, cronExpression);
        String normalized = CronSchedules.normalize(cronExpression);

        ScheduledFuture<?> handle = taskScheduler.schedule(() -> runSafely(policyId, callback),
                new CronTrigger(normalized, zone));

        Registration previous = registrations.put(policyId, new Registration(cronExpression, callback, handle));
        if (previous != null) {
            previous.cancel();
        }
        log.info("{} scheduled policy {} with '{}'", name, policyId, cronExpression);
    }

    /**
     * @return true if a registration was removed
     */
    public boolean unschedule(String policyId) {
        Registration removed = registrations.remove(policyId);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.info("{} unscheduled policy {}", name, policyId);
        return true;
    }

    /**
     * Re-registers a policy with its current expression and callback.
     *
     * @throws NotFoundException if the policy is not scheduled
     */
    public void reschedule(String policyId) {
        Registration current = registrations.get(policyId);
        if (current == null) {
            throw new NotFoundException("Schedule", policyId);
        }
        schedule(policyId, current.expression(), current.callback());
    }

    /**
     * Runs the registered callback immediately on the calling thread.
     *
     * @throws NotFoundException if the policy is not scheduled
     */
    public void trigger(String policyId) {
        Registration current = registrations.get(policyId);
        if (current == null) {
            throw new NotFoundException("Schedule", policyId);
        }
        runSafely(policyId, current.callback());
    }

    public boolean isScheduled(String policyId) {
        return registrations.containsKey(policyId);
    }

    public Set<String> scheduledPolicies() {
        return Set.copyOf(registrations.keySet());
    }

    public String expressionFor(String policyId) {
        Registration current = registrations.get(policyId);
        return current != null ? current.expression() : null;
    }

    public void shutdown() {
        registrations.values().forEach(Registration::cancel);
        int count = registrations.size();
        registrations.clear();
        log.info("{} scheduler stopped, {} registrations cancelled", name, count);
    }

    private void runSafely(String policyId, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("{} run for policy {} failed", name, policyId, e);
        }
    }

    private record Registration(String expression, Runnable callback, ScheduledFuture<?> handle) {

        void cancel() {
            if (handle != null) {
                handle.cancel(false);
            }
        }
    }
}
