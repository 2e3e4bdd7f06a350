/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.ArchiveEntryType;
import villagecompute.newsdigest.api.types.DispatchResultType;
import villagecompute.newsdigest.api.types.EnrichedItemType;
import villagecompute.newsdigest.api.types.EnrichmentResultType;
import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.KeywordRulesType;
import villagecompute.newsdigest.api.types.PipelineRunResultType;
import villagecompute.newsdigest.api.types.PipelineRunResultType.ArchiveStatus;
import villagecompute.newsdigest.api.types.RankingResultType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.exceptions.ArchiveException;
import villagecompute.newsdigest.integration.archive.ArchiveSink;
import villagecompute.newsdigest.integration.slack.NotificationChannel;
import villagecompute.newsdigest.observability.LoggingConfig;
import villagecompute.newsdigest.util.CancellationSignal;

/**
 * Runs one digest: filter, enrich, rank, dispatch, archive.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Apply keyword rules via {@link KeywordFilterService}</li>
 * <li>Cap the enrichment input when {@code process-all} is off</li>
 * <li>Enrich via {@link AiEnrichmentService}</li>
 * <li>Rank via {@link RankingService}</li>
 * <li>Dispatch the notify set via {@link SlackDispatchService}</li>
 * <li>Archive the ranked items plus every filtered item that was not enriched</li>
 * </ol>
 *
 * <p>
 * An empty filter or enrichment result ends the run successfully without touching either sink. An empty notify set
 * skips dispatch but still archives. Archive failures are logged and reported in the result; they never affect
 * delivery status.
 */
@ApplicationScoped
public class DigestPipelineService {

    private static final Logger LOG = Logger.getLogger(DigestPipelineService.class);

    @Inject
    KeywordFilterService filterService;

    @Inject
    AiEnrichmentService enrichmentService;

    @Inject
    RankingService rankingService;

    @Inject
    SlackDispatchService dispatchService;

    @Inject
    NotificationChannel notificationChannel;

    @Inject
    ArchiveSink archiveSink;

    @Inject
    NewsDigestConfig config;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    Clock clock = Clock.systemUTC();

    // Metrics
    private Counter receivedCounter;
    private Counter filteredCounter;
    private Counter enrichedCounter;
    private Counter notifiedCounter;
    private Counter archivedCounter;

    /**
     * Runs the pipeline over already fetched items.
     *
     * @param items
     *            raw feed items
     * @param cancellation
     *            stops new analysis calls and batch sends once raised
     * @return counts and outcomes of the run
     */
    public PipelineRunResultType run(List<FeedItemType> items, CancellationSignal cancellation) {
        initializeMetrics();

        Instant startedAt = clock.instant();
        String runId = UUID.randomUUID().toString().substring(0, 8);

        Span span = tracer.spanBuilder("digest.run").setAttribute("run.id", runId)
                .setAttribute("news.type", config.digest().newsType().name()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRunId(runId);

            PipelineRunResultType result = execute(items, cancellation, startedAt, span);

            span.setAttribute("items.received", result.receivedCount());
            span.setAttribute("items.filtered", result.filteredCount());
            span.setAttribute("items.enriched", result.enrichedCount());
            span.setAttribute("items.notified", result.notifyCount());
            if (result.deliverySucceeded() && !result.cancelled()) {
                span.setStatus(StatusCode.OK);
            } else {
                span.setStatus(StatusCode.ERROR, result.cancelled() ? "cancelled" : "delivery failed");
            }

            logSummary(result, Duration.between(startedAt, clock.instant()));
            return result;

        } catch (RuntimeException e) {
            LOG.errorf(e, "Digest run failed: runId=%s", runId);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private PipelineRunResultType execute(List<FeedItemType> items, CancellationSignal cancellation,
            Instant startedAt, Span span) {
        NewsDigestConfig.Digest digest = config.digest();
        receivedCounter.increment(items.size());

        // Filter
        LoggingConfig.setStage("filter");
        KeywordRulesType rules = KeywordRulesType.of(config.filters().requiredKeywords().orElse(List.of()),
                config.filters().blockedKeywords().orElse(List.of()));
        List<FeedItemType> filtered = filterService.filter(items, rules);
        filteredCounter.increment(filtered.size());

        if (filtered.isEmpty()) {
            LOG.info("No items passed the keyword filter, nothing to do");
            span.addEvent("filter.empty");
            return PipelineRunResultType.shortCircuit(items.size(), 0, 0, 0, "no items passed the filter",
                    cancellation.isCancelled());
        }

        List<FeedItemType> toEnrich = filtered;
        if (!digest.processAll() && filtered.size() > digest.maxArticlesToProcess()) {
            toEnrich = filtered.subList(0, Math.max(0, digest.maxArticlesToProcess()));
            LOG.infof("Processing first %d of %d filtered items", toEnrich.size(), filtered.size());
        }

        // Enrich
        LoggingConfig.setStage("enrich");
        EnrichmentResultType enrichment = enrichmentService.enrich(toEnrich, cancellation);
        enrichedCounter.increment(enrichment.enriched().size());

        if (enrichment.enriched().isEmpty()) {
            LOG.warnf("No items were enriched (skipped=%d), nothing to do", enrichment.skippedCount());
            span.addEvent("enrichment.empty");
            return PipelineRunResultType.shortCircuit(items.size(), filtered.size(), 0, enrichment.skippedCount(),
                    "no items were enriched", enrichment.cancelled() || cancellation.isCancelled());
        }

        // Rank
        LoggingConfig.setStage("rank");
        RankingResultType ranking = rankingService.rank(enrichment.enriched(), digest.minScore(),
                digest.maxArticles());

        // Dispatch
        DispatchResultType dispatch = null;
        if (ranking.notifySet().isEmpty()) {
            LOG.infof("No items reached minScore=%d, skipping notification", digest.minScore());
            span.addEvent("dispatch.skipped");
        } else {
            LoggingConfig.setStage("dispatch");
            dispatch = dispatchService.dispatch(ranking.notifySet(), notificationChannel,
                    config.slack().maxBatchSize(), config.slack().maxRetries(), cancellation);
            notifiedCounter.increment(dispatch.deliveredItemCount());
        }

        // Archive
        LoggingConfig.setStage("archive");
        List<ArchiveEntryType> entries = archiveEntries(ranking.archiveSet(), filtered);
        ArchiveStatus archiveStatus;
        if (!config.archive().enabled()) {
            LOG.debug("Archive disabled");
            archiveStatus = ArchiveStatus.DISABLED;
        } else {
            try {
                String location = archiveSink.write(entries, startedAt, digest.newsType().label());
                archivedCounter.increment(entries.size());
                archiveStatus = ArchiveStatus.WRITTEN;
                LOG.infof("Archive written: entries=%d, location=%s", entries.size(), location);
            } catch (ArchiveException e) {
                LOG.errorf(e, "Failed to archive %d entries", entries.size());
                span.recordException(e);
                archiveStatus = ArchiveStatus.FAILED;
            }
        }

        return new PipelineRunResultType(items.size(), filtered.size(), enrichment.enriched().size(),
                enrichment.skippedCount(), ranking.notifySet().size(), dispatch, archiveStatus, entries.size(), null,
                enrichment.cancelled() || cancellation.isCancelled());
    }

    /**
     * Merges ranked enriched items with the filtered items that were never enriched, de-duplicated by URL.
     *
     * @param ranked
     *            enriched items in ranked order
     * @param filtered
     *            every item that passed the filter
     * @return archive rows, enriched first
     */
    static List<ArchiveEntryType> archiveEntries(List<EnrichedItemType> ranked, List<FeedItemType> filtered) {
        Map<String, ArchiveEntryType> byUrl = new LinkedHashMap<>();
        for (EnrichedItemType item : ranked) {
            byUrl.putIfAbsent(item.url(), ArchiveEntryType.enriched(item));
        }
        for (FeedItemType item : filtered) {
            byUrl.putIfAbsent(item.url(), ArchiveEntryType.unenriched(item));
        }
        return new ArrayList<>(byUrl.values());
    }

    private void logSummary(PipelineRunResultType result, Duration elapsed) {
        LOG.infof(
                "Digest run summary: received=%d, filtered=%d, enriched=%d, skipped=%d, notified=%d, "
                        + "delivered=%s, archive=%s (%d rows), cancelled=%s, duration=%dms%s",
                result.receivedCount(), result.filteredCount(), result.enrichedCount(), result.skippedCount(),
                result.notifyCount(), result.deliverySucceeded(), result.archiveStatus(), result.archivedCount(),
                result.cancelled(), elapsed.toMillis(),
                result.isShortCircuited() ? ", ended early: " + result.shortCircuitReason() : "");
    }

    /**
     * Initializes Micrometer metrics on first invocation.
     */
    private void initializeMetrics() {
        if (receivedCounter == null) {
            receivedCounter = stageCounter("received");
            filteredCounter = stageCounter("filtered");
            enrichedCounter = stageCounter("enriched");
            notifiedCounter = stageCounter("notified");
            archivedCounter = stageCounter("archived");
        }
    }

    private Counter stageCounter(String stage) {
        return Counter.builder("digest.items.total").tag("stage", stage).description("Items reaching each stage")
                .register(meterRegistry);
    }
}
