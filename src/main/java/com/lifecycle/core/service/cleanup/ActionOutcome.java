package com.lifecycle.core.service.cleanup;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Result of applying one action to a batch of items.
 *
 * @param processed items the action was applied to (or would have been, in a dry run)
 * @param sizeFreed bytes released from the source location
 * @param errors one message per failed item
 * @param bundles archive bundles written by the batch
 * @param cancelled whether the batch stopped early on cancellation
 */
public record ActionOutcome(
        int processed,
        long sizeFreed,
        List<String> errors,
        List<Path> bundles,
        boolean cancelled
) {

    public static ActionOutcome empty() {
        return new ActionOutcome(0, 0, List.of(), List.of(), false);
    }

    public ActionOutcome plus(ActionOutcome other) {
        return new ActionOutcome(
                processed + other.processed,
                sizeFreed + other.sizeFreed,
                concat(errors, other.errors),
                concat(bundles, other.bundles),
                cancelled || other.cancelled);
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        if (second.isEmpty()) {
            return first;
        }
        if (first.isEmpty()) {
            return second;
        }
        return Stream.concat(first.stream(), second.stream()).toList();
    }
}
