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
 * A feed item merged with a fully validated analysis result.
 *
 * <p>
 * Instances only exist for items whose analysis response passed validation; {@code score} is therefore always within
 * [1,10]. The {@code annotations} map carries the free-text analysis extras (related companies, market impact,
 * investment insight) in the order the model returned them.
 *
 * @param item
 *            the original feed item
 * @param analysisSummary
 *            model-written summary of the article
 * @param score
 *            importance score in [1,10]
 * @param category
 *            category label as returned by the model
 * @param annotations
 *            opaque pass-through analysis fields keyed by response field name
 */
public record EnrichedItemType(FeedItemType item, String analysisSummary, int score, String category,
        Map<String, String> annotations) {

    public static final String RELATED_COMPANIES = "related_companies";

    public static final String MARKET_IMPACT = "market_impact";

    public static final String INVESTMENT_INSIGHT = "investment_insight";

    public EnrichedItemType {
        annotations = annotations != null ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations)) : Map.of();
    }

    /**
     * Builds an enriched item from a feed item and its validated analysis.
     */
    public static EnrichedItemType of(FeedItemType item, AnalysisResultType analysis) {
        return new EnrichedItemType(item, analysis.summary(), analysis.score(), analysis.category(),
                analysis.annotations());
    }

    public String title() {
        return item.title();
    }

    public String url() {
        return item.url();
    }

    public String source() {
        return item.source();
    }

    /**
     * Returns the annotation for the given response field, or an empty string when the model did not provide it.
     */
    public String annotation(String key) {
        return annotations.getOrDefault(key, "");
    }
}
