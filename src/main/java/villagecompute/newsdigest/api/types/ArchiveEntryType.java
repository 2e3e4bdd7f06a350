/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row handed to the archive: either an enriched item or a filtered item the analysis never covered.
 *
 * @param item
 *            the feed item
 * @param analysisSummary
 *            model summary, empty for unenriched items
 * @param score
 *            score, or null for unenriched items
 * @param category
 *            category label, empty for unenriched items
 * @param annotations
 *            analysis annotations, empty for unenriched items
 */
public record ArchiveEntryType(FeedItemType item, String analysisSummary, Integer score, String category,
        Map<String, String> annotations) {

    public ArchiveEntryType {
        analysisSummary = analysisSummary != null ? analysisSummary : "";
        category = category != null ? category : "";
        annotations = annotations != null ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations)) : Map.of();
    }

    public static ArchiveEntryType enriched(EnrichedItemType enriched) {
        return new ArchiveEntryType(enriched.item(), enriched.analysisSummary(), enriched.score(),
                enriched.category(), enriched.annotations());
    }

    public static ArchiveEntryType unenriched(FeedItemType item) {
        return new ArchiveEntryType(item, "", null, "", Map.of());
    }

    public boolean isEnriched() {
        return score != null;
    }
}
