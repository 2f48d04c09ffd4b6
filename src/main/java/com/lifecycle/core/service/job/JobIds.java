package com.lifecycle.core.service.job;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates opaque ids of the form {@code <prefix>_<epochMillis>_<9 base36 chars>}.
 */
public final class JobIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 9;

    private JobIds() {
    }

    public static String next(String prefix, Clock clock) {
        var random = ThreadLocalRandom.current();
        var suffix = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return prefix + "_" + clock.millis() + "_" + suffix;
    }
}
