/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * Outcome of enriching one item: exactly one of {@code enriched} or {@code skipped} is non-null.
 *
 * @param enriched
 *            the enriched item on success
 * @param skipped
 *            the skipped item and reason on failure
 */
public record EnrichmentOutcomeType(EnrichedItemType enriched, SkippedItemType skipped) {

    public static EnrichmentOutcomeType enriched(EnrichedItemType enriched) {
        return new EnrichmentOutcomeType(enriched, null);
    }

    public static EnrichmentOutcomeType skipped(FeedItemType item, String reason) {
        return new EnrichmentOutcomeType(null, new SkippedItemType(item, reason));
    }

    public boolean isEnriched() {
        return enriched != null;
    }
}
