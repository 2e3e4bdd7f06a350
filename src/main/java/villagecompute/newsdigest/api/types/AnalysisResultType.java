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
 * Typed result of a validated analysis response.
 *
 * <p>
 * <b>Field Descriptions:</b>
 * <ul>
 * <li>{@code summary}: detailed article summary written by the model</li>
 * <li>{@code score}: importance score, already coerced into [1,10]</li>
 * <li>{@code category}: category label, unknown labels are kept verbatim</li>
 * <li>{@code annotations}: any additional text fields (related_companies, market_impact, investment_insight)</li>
 * <li>{@code scoreFallbackApplied}: true when the raw score was missing a usable value and the neutral score was
 * substituted</li>
 * </ul>
 *
 * @param summary
 *            model summary
 * @param score
 *            validated score in [1,10]
 * @param category
 *            category label
 * @param annotations
 *            additional text fields in response order
 * @param scoreFallbackApplied
 *            whether the neutral fallback score replaced the raw value
 */
public record AnalysisResultType(String summary, int score, String category, Map<String, String> annotations,
        boolean scoreFallbackApplied) {

    public AnalysisResultType {
        annotations = annotations != null ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations)) : Map.of();
    }
}
