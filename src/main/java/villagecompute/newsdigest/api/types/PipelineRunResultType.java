/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * Summary of one pipeline run.
 *
 * <p>
 * {@code dispatch} is null when the run never reached the dispatcher (short-circuit on an empty stage, or an empty
 * notify set). {@code archiveStatus} records what happened at the archival sink, which does not influence
 * {@link #deliverySucceeded()}.
 *
 * @param receivedCount
 *            items handed to the pipeline
 * @param filteredCount
 *            items that passed the keyword filter
 * @param enrichedCount
 *            items enriched successfully
 * @param skippedCount
 *            items dropped during enrichment
 * @param notifyCount
 *            items selected for notification
 * @param dispatch
 *            dispatch result, or null when nothing was dispatched
 * @param archiveStatus
 *            archival outcome
 * @param archivedCount
 *            rows handed to the archive
 * @param shortCircuitReason
 *            why the run ended early, or null when every stage ran
 * @param cancelled
 *            whether cancellation was requested during the run
 */
public record PipelineRunResultType(int receivedCount, int filteredCount, int enrichedCount, int skippedCount,
        int notifyCount, DispatchResultType dispatch, ArchiveStatus archiveStatus, int archivedCount,
        String shortCircuitReason, boolean cancelled) {

    /**
     * Archival outcome of a run.
     */
    public enum ArchiveStatus {
        WRITTEN, FAILED, DISABLED, NOT_REACHED
    }

    public static PipelineRunResultType shortCircuit(int receivedCount, int filteredCount, int enrichedCount,
            int skippedCount, String reason, boolean cancelled) {
        return new PipelineRunResultType(receivedCount, filteredCount, enrichedCount, skippedCount, 0, null,
                ArchiveStatus.NOT_REACHED, 0, reason, cancelled);
    }

    /**
     * True unless a dispatch took place and at least one batch failed.
     */
    public boolean deliverySucceeded() {
        return dispatch == null || dispatch.allSucceeded();
    }

    public boolean isShortCircuited() {
        return shortCircuitReason != null;
    }
}
