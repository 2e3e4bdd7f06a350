/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.util;

import java.time.Duration;

/**
 * Blocking pause used between retries and batch sends.
 *
 * <p>
 * Services hold a {@code Sleeper} field defaulting to {@link #SYSTEM}; unit tests replace it with a recording
 * implementation so retry timing can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the current thread. */
    Sleeper SYSTEM = duration -> {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * Pauses for the given duration.
     *
     * @param duration
     *            how long to pause; zero or negative durations return immediately
     * @throws InterruptedException
     *             if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;
}
