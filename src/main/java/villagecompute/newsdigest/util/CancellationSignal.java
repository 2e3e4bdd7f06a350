/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.util;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag for a pipeline run.
 *
 * <p>
 * Stages check {@link #isCancelled()} before starting a new enrichment call or batch send. Calls already in flight are
 * never interrupted; they complete or time out on their own. Safe to raise from another thread (e.g. a JVM shutdown
 * hook).
 */
public final class CancellationSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Returns a signal that is never raised.
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Requests cancellation. Only the first reason is kept.
     *
     * @param why
     *            short description for logs
     */
    public void cancel(String why) {
        reason.compareAndSet(null, why != null ? why : "cancelled");
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Returns the cancellation reason, or null when not cancelled.
     */
    public String reason() {
        return reason.get();
    }
}
