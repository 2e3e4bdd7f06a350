/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.List;

/**
 * One notification message worth of ranked items.
 *
 * @param batchIndex
 *            zero-based position of this batch
 * @param totalBatches
 *            number of batches in the dispatch
 * @param totalItemCount
 *            number of items across all batches
 * @param startOffset
 *            zero-based rank of this batch's first item in the full notify set
 * @param items
 *            items in rank order
 */
public record NotificationBatchType(int batchIndex, int totalBatches, int totalItemCount, int startOffset,
        List<EnrichedItemType> items) {

    public NotificationBatchType {
        items = List.copyOf(items);
    }

    public boolean isFirst() {
        return batchIndex == 0;
    }

    public boolean isLast() {
        return batchIndex == totalBatches - 1;
    }
}
