/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * A feed item that did not make it through enrichment, with the reason it was dropped.
 *
 * @param item
 *            the item that was skipped
 * @param reason
 *            short human-readable reason (parse failure, missing field, service error, cancelled)
 */
public record SkippedItemType(FeedItemType item, String reason) {
}
