/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import java.util.ArrayList;
import java.util.List;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.AnalysisResultType;
import villagecompute.newsdigest.api.types.EnrichedItemType;
import villagecompute.newsdigest.api.types.EnrichmentOutcomeType;
import villagecompute.newsdigest.api.types.EnrichmentResultType;
import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.NewsType;
import villagecompute.newsdigest.api.types.SkippedItemType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.exceptions.AnalysisServiceException;
import villagecompute.newsdigest.exceptions.AnalysisValidationException;
import villagecompute.newsdigest.integration.ai.AnalysisService;
import villagecompute.newsdigest.observability.LoggingConfig;
import villagecompute.newsdigest.util.CancellationSignal;

/**
 * Enriches feed items with a scored, categorized analysis from the external analysis service.
 *
 * <p>
 * <b>Enrichment Process (per item, sequential):</b>
 * <ol>
 * <li>Build a prompt from source, title, URL, the length-capped body and the run's news-type context</li>
 * <li>Call {@link AnalysisService#analyze}</li>
 * <li>Validate the response with {@link AnalysisResponseParser}</li>
 * <li>Merge the validated analysis onto the item</li>
 * </ol>
 *
 * <p>
 * Individual item failures (service errors, invalid responses) do NOT fail the run: the item is recorded as skipped
 * with a reason and processing continues with the next item. Cancellation stops new calls; the in-flight call is
 * allowed to complete.
 */
@ApplicationScoped
public class AiEnrichmentService {

    private static final Logger LOG = Logger.getLogger(AiEnrichmentService.class);

    static final String SYSTEM_PROMPT = """
            You are a professional news analyst and investment advisor. Analyze the article you are given and respond \
            with ONLY valid JSON (no markdown, no explanation) in this exact format:
            {
              "summary": "a 2-3 sentence summary of the key facts",
              "score": 7,
              "category": "RESEARCH",
              "related_companies": "listed companies involved, with tickers or stock codes",
              "market_impact": "expected effect on the market or sector",
              "investment_insight": "what an investor should watch"
            }

            RULES:
            1. score is an integer from 1 (irrelevant) to 10 (major, market-moving news)
            2. category must be one of: RESEARCH, PRODUCT, INDUSTRY, MARKET, POLICY, OPINION
            3. Use an empty string for related_companies, market_impact or investment_insight when not applicable
            """;

    @Inject
    AnalysisService analysisService;

    @Inject
    AnalysisResponseParser responseParser;

    @Inject
    NewsDigestConfig config;

    @Inject
    MeterRegistry meterRegistry;

    // Metrics
    private Counter successCounter;
    private Counter skippedCounter;

    /**
     * Enriches the given items in order.
     *
     * @param items
     *            filtered feed items
     * @param cancellation
     *            checked before each analysis call
     * @return enriched items in input order, skipped items with reasons, and whether the run was cancelled
     */
    public EnrichmentResultType enrich(List<FeedItemType> items, CancellationSignal cancellation) {
        initializeMetrics();

        NewsType newsType = config.digest().newsType();
        List<EnrichedItemType> enriched = new ArrayList<>();
        List<SkippedItemType> skipped = new ArrayList<>();
        boolean cancelled = false;

        for (int i = 0; i < items.size(); i++) {
            if (cancellation.isCancelled()) {
                LOG.warnf("Enrichment cancelled after %d/%d items: reason=%s", i, items.size(),
                        cancellation.reason());
                cancelled = true;
                break;
            }

            FeedItemType item = items.get(i);
            LOG.debugf("Analyzing item %d/%d: title=\"%s\"", i + 1, items.size(), item.title());

            EnrichmentOutcomeType outcome = enrichItem(item, newsType);
            if (outcome.isEnriched()) {
                enriched.add(outcome.enriched());
                successCounter.increment();
            } else {
                skipped.add(outcome.skipped());
                skippedCounter.increment();
            }
        }

        LOG.infof("Enrichment complete: enriched=%d, skipped=%d, total=%d%s", enriched.size(), skipped.size(),
                items.size(), cancelled ? " (cancelled)" : "");
        return new EnrichmentResultType(enriched, skipped, cancelled);
    }

    /**
     * Analyzes a single item.
     *
     * @param item
     *            the item to analyze
     * @param newsType
     *            domain context appended to the prompt
     * @return the enriched item, or a skip with reason
     */
    EnrichmentOutcomeType enrichItem(FeedItemType item, NewsType newsType) {
        LoggingConfig.setItemUrl(item.url());
        try {
            String response = analysisService.analyze(SYSTEM_PROMPT, buildPrompt(item, newsType));
            AnalysisResultType analysis = responseParser.parse(response);

            LOG.debugf("Analyzed item: title=\"%s\", score=%d, category=%s", item.title(), analysis.score(),
                    analysis.category());
            return EnrichmentOutcomeType.enriched(EnrichedItemType.of(item, analysis));

        } catch (AnalysisValidationException e) {
            LOG.warnf("Invalid analysis response, skipping item: reason=%s, title=\"%s\", url=%s, error=%s",
                    e.getReason(), item.title(), item.url(), e.getMessage());
            return EnrichmentOutcomeType.skipped(item, "invalid response: " + e.getReason());

        } catch (AnalysisServiceException e) {
            LOG.errorf(e, "Analysis call failed, skipping item: title=\"%s\", url=%s", item.title(), item.url());
            return EnrichmentOutcomeType.skipped(item, "analysis failed: " + e.getMessage());

        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error analyzing item, skipping: title=\"%s\", url=%s", item.title(), item.url());
            return EnrichmentOutcomeType.skipped(item, "unexpected error: " + e.getClass().getSimpleName());

        } finally {
            LoggingConfig.setItemUrl(null);
        }
    }

    /**
     * Builds the per-item analysis prompt.
     */
    String buildPrompt(FeedItemType item, NewsType newsType) {
        int maxBodyLength = config.analysis().maxBodyLength();
        String body = item.body();
        if (body.length() > maxBodyLength) {
            body = body.substring(0, maxBodyLength) + "...";
        }

        return String.format("""
                %s

                ARTICLE:
                Source: %s
                Title: %s
                URL: %s
                Content: %s
                """, newsType.promptContext(), item.source(), item.title(), item.url(), body);
    }

    /**
     * Initializes Micrometer metrics on first invocation.
     */
    private void initializeMetrics() {
        if (successCounter == null) {
            successCounter = Counter.builder("digest.enrichment.items.total").tag("status", "success")
                    .description("Items enriched successfully").register(meterRegistry);
        }

        if (skippedCounter == null) {
            skippedCounter = Counter.builder("digest.enrichment.items.total").tag("status", "skipped")
                    .description("Items skipped during enrichment").register(meterRegistry);
        }
    }
}
