/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.KeywordRulesType;

/**
 * Cheap local pre-filter applied before any analysis call.
 *
 * <p>
 * The haystack is the lower-cased {@code title + " " + body}. An item is rejected when any blocked term occurs in it.
 * Otherwise, when required terms are configured, at least one must occur; with no required terms every item passes.
 * Matching is plain substring containment, so {@code "ai"} also matches {@code "said"}.
 *
 * <p>
 * Output order follows input order and no item is duplicated. The service holds no state.
 */
@ApplicationScoped
public class KeywordFilterService {

    private static final Logger LOG = Logger.getLogger(KeywordFilterService.class);

    /**
     * Applies keyword rules to the given items.
     *
     * @param items
     *            raw feed items
     * @param rules
     *            required/blocked terms (already lower-cased)
     * @return the accepted items in input order
     */
    public List<FeedItemType> filter(List<FeedItemType> items, KeywordRulesType rules) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        List<FeedItemType> accepted = new ArrayList<>();
        int blockedCount = 0;
        int unmatchedCount = 0;

        for (FeedItemType item : items) {
            String haystack = (item.title() + " " + item.body()).toLowerCase(Locale.ROOT);

            String blockedTerm = findTerm(haystack, rules.blocked());
            if (blockedTerm != null) {
                blockedCount++;
                LOG.debugf("Blocked item: term=\"%s\", title=\"%s\"", blockedTerm, item.title());
                continue;
            }

            if (!rules.required().isEmpty() && findTerm(haystack, rules.required()) == null) {
                unmatchedCount++;
                continue;
            }

            accepted.add(item);
        }

        LOG.infof("Keyword filter: %d/%d items accepted (blocked=%d, no required keyword=%d)", accepted.size(),
                items.size(), blockedCount, unmatchedCount);
        return accepted;
    }

    private static String findTerm(String haystack, Iterable<String> terms) {
        for (String term : terms) {
            if (haystack.contains(term)) {
                return term;
            }
        }
        return null;
    }
}
