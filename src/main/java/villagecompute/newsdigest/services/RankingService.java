/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.EnrichedItemType;
import villagecompute.newsdigest.api.types.RankingResultType;

/**
 * Orders enriched items by score and selects the ones worth notifying.
 *
 * <p>
 * The archive set is every enriched item sorted by score descending; ties keep their input order. The notify set is
 * the prefix of that ordering with {@code score >= minScore}, at most {@code maxNotify} long.
 */
@ApplicationScoped
public class RankingService {

    private static final Logger LOG = Logger.getLogger(RankingService.class);

    public RankingResultType rank(List<EnrichedItemType> enriched, int minScore, int maxNotify) {
        List<EnrichedItemType> archiveSet = new ArrayList<>(enriched);
        // List.sort is stable
        archiveSet.sort(Comparator.comparingInt(EnrichedItemType::score).reversed());

        List<EnrichedItemType> notifySet = archiveSet.stream().filter(item -> item.score() >= minScore)
                .limit(Math.max(0, maxNotify)).toList();

        LOG.infof("Ranked %d items: %d selected for notification (minScore=%d, maxNotify=%d)", archiveSet.size(),
                notifySet.size(), minScore, maxNotify);
        return new RankingResultType(notifySet, archiveSet);
    }
}
