/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import villagecompute.newsdigest.api.types.NewsType;

/**
 * Typed settings for a digest run, loaded once at startup from {@code application.yaml} and environment variables.
 *
 * <p>
 * Services receive this mapping by injection; the pure pipeline stages (filter, ranker) receive plain values taken
 * from it. Nothing reads configuration from static state.
 *
 * <p>
 * <b>Required values:</b> {@code newsdigest.slack.webhook-url} (from {@code SLACK_WEBHOOK_URL}). A missing webhook
 * fails application startup before any network call.
 *
 * @see AiConfig for analysis model settings
 */
@ConfigMapping(
        prefix = "newsdigest")
public interface NewsDigestConfig {

    /** Feeds to fetch. */
    List<Feed> feeds();

    Filters filters();

    Digest digest();

    Slack slack();

    Archive archive();

    Analysis analysis();

    interface Feed {

        String name();

        String url();

        @WithDefault("true")
        boolean enabled();
    }

    interface Filters {

        /** At least one of these terms must occur in title or body. Absent or empty accepts every item. */
        Optional<List<String>> requiredKeywords();

        /** Items containing any of these terms are rejected. */
        Optional<List<String>> blockedKeywords();
    }

    interface Digest {

        /** Minimum score for an item to be notified. */
        @WithDefault("6")
        int minScore();

        /** Maximum number of notified items per run. */
        @WithDefault("10")
        int maxArticles();

        /** Entries taken from the head of each feed. */
        @WithDefault("15")
        int articlesPerFeed();

        /** Enrichment cap applied when {@link #processAll()} is false. */
        @WithDefault("50")
        int maxArticlesToProcess();

        /** Enrich every filtered item instead of only the first {@link #maxArticlesToProcess()}. */
        @WithDefault("true")
        boolean processAll();

        @WithDefault("AI")
        NewsType newsType();
    }

    interface Slack {

        String webhookUrl();

        @WithDefault("AI News Digest")
        String title();

        @WithDefault("true")
        boolean showScore();

        @WithDefault("true")
        boolean showCategory();

        @WithDefault("true")
        boolean showSource();

        /** Items per message; clamped to what one Slack message can hold. */
        @WithDefault("15")
        int maxBatchSize();

        /** Send attempts per batch. */
        @WithDefault("3")
        int maxRetries();

        @WithDefault("10s")
        Duration requestTimeout();

        /** Pause between successive batch sends. */
        @WithDefault("1s")
        Duration batchPause();

        /** Wait applied to a 429 response without a usable Retry-After header. */
        @WithDefault("5s")
        Duration defaultRetryAfter();

        /** Upper bound for any server-requested wait. */
        @WithDefault("60s")
        Duration maxRetryAfter();

        /** Post an error message to the channel when a run fails unexpectedly. */
        @WithDefault("true")
        boolean errorNotifications();
    }

    interface Archive {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("archive")
        String directory();
    }

    interface Analysis {

        /** Characters of item body included in the analysis prompt. */
        @WithDefault("800")
        int maxBodyLength();
    }
}
