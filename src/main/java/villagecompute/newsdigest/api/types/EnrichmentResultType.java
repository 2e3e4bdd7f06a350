/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.List;

/**
 * Aggregate result of an enrichment pass.
 *
 * @param enriched
 *            successfully enriched items, in input order
 * @param skipped
 *            items dropped during enrichment, in input order
 * @param cancelled
 *            true when the pass stopped early because cancellation was requested
 */
public record EnrichmentResultType(List<EnrichedItemType> enriched, List<SkippedItemType> skipped,
        boolean cancelled) {

    public EnrichmentResultType {
        enriched = List.copyOf(enriched);
        skipped = List.copyOf(skipped);
    }

    public int skippedCount() {
        return skipped.size();
    }
}
