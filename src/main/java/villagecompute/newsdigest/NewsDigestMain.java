/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest;

import java.util.List;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.PipelineRunResultType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.integration.feeds.RssFeedClient;
import villagecompute.newsdigest.integration.slack.NotificationChannel;
import villagecompute.newsdigest.services.DigestPipelineService;
import villagecompute.newsdigest.services.SlackDispatchService;
import villagecompute.newsdigest.util.CancellationSignal;

/**
 * Command-mode entry point: fetches the configured feeds, runs one digest and exits.
 *
 * <p>
 * <b>Exit codes:</b> 0 when the run completes through every applicable stage (including runs that end early because
 * nothing passed the filter or enrichment), 1 when a notification batch failed, the run was cancelled, or an
 * unexpected error occurred. Archive failures are logged and do not change the exit code. Configuration errors fail
 * Quarkus startup before this class runs.
 */
@QuarkusMain
public class NewsDigestMain implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(NewsDigestMain.class);

    static final int EXIT_OK = 0;

    static final int EXIT_FAILURE = 1;

    @Inject
    RssFeedClient feedClient;

    @Inject
    DigestPipelineService pipelineService;

    @Inject
    SlackDispatchService dispatchService;

    @Inject
    NotificationChannel notificationChannel;

    @Inject
    NewsDigestConfig config;

    public static void main(String... args) {
        Quarkus.run(NewsDigestMain.class, args);
    }

    @Override
    public int run(String... args) {
        CancellationSignal cancellation = new CancellationSignal();
        Thread shutdownHook = new Thread(() -> cancellation.cancel("shutdown requested"), "digest-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            return runDigest(cancellation);
        } finally {
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Fetches feeds, runs the pipeline and maps the outcome to an exit code.
     */
    int runDigest(CancellationSignal cancellation) {
        try {
            LOG.infof("Starting news digest: newsType=%s", config.digest().newsType());

            List<FeedItemType> items = feedClient.fetchConfigured();
            PipelineRunResultType result = pipelineService.run(items, cancellation);

            if (result.cancelled()) {
                LOG.warnf("Digest run cancelled: %s", cancellation.reason());
                return EXIT_FAILURE;
            }
            if (!result.deliverySucceeded()) {
                LOG.errorf("Digest delivery failed: batches=%s", result.dispatch().perBatchStatus());
                return EXIT_FAILURE;
            }
            if (result.archiveStatus() == PipelineRunResultType.ArchiveStatus.FAILED) {
                LOG.warn("Digest delivered but the archive could not be written");
            }
            return EXIT_OK;

        } catch (RuntimeException e) {
            LOG.errorf(e, "News digest run failed");
            if (config.slack().errorNotifications()) {
                dispatchService.sendErrorNotification(notificationChannel,
                        e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            return EXIT_FAILURE;
        }
    }

    private void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook has run or will run
            LOG.debug("Shutdown in progress, leaving shutdown hook registered");
        }
    }
}
