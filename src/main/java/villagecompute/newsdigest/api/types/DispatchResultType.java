/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.List;

/**
 * Result of dispatching a notify set.
 *
 * @param batches
 *            per-batch status in batch order
 */
public record DispatchResultType(List<BatchStatusType> batches) {

    public DispatchResultType {
        batches = List.copyOf(batches);
    }

    /**
     * True when every batch was delivered. An empty dispatch trivially succeeds.
     */
    public boolean allSucceeded() {
        return batches.stream().allMatch(BatchStatusType::succeeded);
    }

    public List<Boolean> perBatchStatus() {
        return batches.stream().map(BatchStatusType::succeeded).toList();
    }

    public int deliveredItemCount() {
        return batches.stream().filter(BatchStatusType::succeeded).mapToInt(BatchStatusType::itemCount).sum();
    }
}
