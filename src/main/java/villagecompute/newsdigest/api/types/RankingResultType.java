/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.List;

/**
 * Output of ranking.
 *
 * @param notifySet
 *            highest-scored items at or above the minimum score, capped for notification
 * @param archiveSet
 *            every enriched item, sorted by score descending (stable on ties)
 */
public record RankingResultType(List<EnrichedItemType> notifySet, List<EnrichedItemType> archiveSet) {

    public RankingResultType {
        notifySet = List.copyOf(notifySet);
        archiveSet = List.copyOf(archiveSet);
    }
}
