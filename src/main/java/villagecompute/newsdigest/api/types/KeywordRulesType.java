/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Required and blocked keyword sets for the pre-filter.
 *
 * <p>
 * Terms are lower-cased and blank terms dropped at construction, so matching is case-insensitive.
 *
 * @param required
 *            at least one of these must appear (empty set accepts everything)
 * @param blocked
 *            none of these may appear; evaluated before {@code required}
 */
public record KeywordRulesType(Set<String> required, Set<String> blocked) {

    public KeywordRulesType {
        required = normalize(required);
        blocked = normalize(blocked);
    }

    public static KeywordRulesType of(List<String> required, List<String> blocked) {
        return new KeywordRulesType(required != null ? new LinkedHashSet<>(required) : Set.of(),
                blocked != null ? new LinkedHashSet<>(blocked) : Set.of());
    }

    private static Set<String> normalize(Set<String> terms) {
        Set<String> normalized = new LinkedHashSet<>();
        if (terms != null) {
            for (String term : terms) {
                if (term != null && !term.isBlank()) {
                    normalized.add(term.toLowerCase(Locale.ROOT));
                }
            }
        }
        return Set.copyOf(normalized);
    }
}
