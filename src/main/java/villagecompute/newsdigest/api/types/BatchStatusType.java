/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * Terminal delivery status of one batch.
 *
 * @param batchIndex
 *            zero-based batch position
 * @param itemCount
 *            number of items in the batch
 * @param succeeded
 *            true when the channel accepted the batch
 * @param attempts
 *            number of send attempts made (0 when cancelled before the first attempt)
 * @param failureReason
 *            why the batch failed, or null on success
 */
public record BatchStatusType(int batchIndex, int itemCount, boolean succeeded, int attempts, String failureReason) {

    public static BatchStatusType success(int batchIndex, int itemCount, int attempts) {
        return new BatchStatusType(batchIndex, itemCount, true, attempts, null);
    }

    public static BatchStatusType failure(int batchIndex, int itemCount, int attempts, String reason) {
        return new BatchStatusType(batchIndex, itemCount, false, attempts, reason);
    }
}
