/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.BatchStatusType;
import villagecompute.newsdigest.api.types.ChannelResponseType;
import villagecompute.newsdigest.api.types.DispatchResultType;
import villagecompute.newsdigest.api.types.EnrichedItemType;
import villagecompute.newsdigest.api.types.NotificationBatchType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.integration.slack.NotificationChannel;
import villagecompute.newsdigest.integration.slack.SlackMessageRenderer;
import villagecompute.newsdigest.observability.LoggingConfig;
import villagecompute.newsdigest.util.CancellationSignal;
import villagecompute.newsdigest.util.Sleeper;

/**
 * Delivers the notify set to a notification channel in size-limited batches.
 *
 * <p>
 * <b>Per-batch attempt handling</b> (attempts {@code n = 0..maxRetries-1}):
 * <ul>
 * <li><b>2xx:</b> batch delivered</li>
 * <li><b>429:</b> wait the server's {@code Retry-After} (configured default when absent, capped at the configured
 * ceiling), then retry unless this was the last attempt</li>
 * <li><b>Timeout / transport error:</b> wait {@code 2^n} seconds, then retry unless this was the last attempt</li>
 * <li><b>Any other status:</b> batch failed, not retried</li>
 * </ul>
 *
 * <p>
 * A failed batch does not stop later batches. Successive batch sends are separated by the configured pause.
 * Cancellation is checked before every attempt; once raised, remaining batches are marked failed without being sent.
 * An interrupt restores the thread's interrupt flag and fails the remaining batches.
 */
@ApplicationScoped
public class SlackDispatchService {

    private static final Logger LOG = Logger.getLogger(SlackDispatchService.class);

    @Inject
    SlackMessageRenderer renderer;

    @Inject
    NewsDigestConfig config;

    @Inject
    MeterRegistry meterRegistry;

    Sleeper sleeper = Sleeper.SYSTEM;

    // Metrics
    private Counter batchSuccessCounter;
    private Counter batchFailureCounter;
    private Counter attemptSuccessCounter;
    private Counter attemptRateLimitedCounter;
    private Counter attemptTransportErrorCounter;
    private Counter attemptRejectedCounter;

    /**
     * Sends the notify set in batches.
     *
     * @param notifySet
     *            ranked items to deliver
     * @param channel
     *            destination channel
     * @param maxBatchSize
     *            requested items per message, clamped to {@link SlackMessageRenderer#maxItemsPerMessage()}
     * @param maxRetries
     *            attempts per batch (at least one attempt is always made)
     * @param cancellation
     *            checked before every send attempt
     * @return per-batch outcome
     */
    public DispatchResultType dispatch(List<EnrichedItemType> notifySet, NotificationChannel channel, int maxBatchSize,
            int maxRetries, CancellationSignal cancellation) {
        initializeMetrics();

        if (notifySet.isEmpty()) {
            LOG.debug("Nothing to dispatch");
            return new DispatchResultType(List.of());
        }

        int batchSize = Math.max(1, Math.min(maxBatchSize, SlackMessageRenderer.maxItemsPerMessage()));
        if (batchSize != maxBatchSize) {
            LOG.warnf("Batch size %d adjusted to %d (message limit)", maxBatchSize, batchSize);
        }
        int maxAttempts = Math.max(1, maxRetries);

        List<List<EnrichedItemType>> partitions = Lists.partition(notifySet, batchSize);
        List<BatchStatusType> statuses = new ArrayList<>();

        LOG.infof("Dispatching %d items in %d batch(es) of up to %d", notifySet.size(), partitions.size(), batchSize);

        try {
            for (int i = 0; i < partitions.size(); i++) {
                LoggingConfig.setBatchIndex(i + 1);
                NotificationBatchType batch = new NotificationBatchType(i, partitions.size(), notifySet.size(),
                        i * batchSize, partitions.get(i));

                BatchStatusType status = deliverBatch(batch, channel, maxAttempts, cancellation);
                statuses.add(status);

                if (status.succeeded()) {
                    batchSuccessCounter.increment();
                    LOG.infof("Batch %d/%d delivered: items=%d, attempts=%d", i + 1, partitions.size(),
                            status.itemCount(), status.attempts());
                } else {
                    batchFailureCounter.increment();
                    LOG.errorf("Batch %d/%d failed: items=%d, attempts=%d, reason=%s", i + 1, partitions.size(),
                            status.itemCount(), status.attempts(), status.failureReason());
                }
            }
        } finally {
            LoggingConfig.setBatchIndex(null);
        }

        DispatchResultType result = new DispatchResultType(statuses);
        LOG.infof("Dispatch complete: delivered=%d/%d items, batches ok=%s", result.deliveredItemCount(),
                notifySet.size(), result.perBatchStatus());
        return result;
    }

    /**
     * Posts a single-attempt error message to the channel.
     *
     * @return true when the channel accepted the message
     */
    public boolean sendErrorNotification(NotificationChannel channel, String message) {
        try {
            ChannelResponseType response = channel.send(renderer.renderError(message));
            if (response.isSuccess()) {
                LOG.info("Error notification sent");
                return true;
            }
            LOG.errorf("Error notification rejected: status=%d", response.statusCode());
            return false;
        } catch (IOException e) {
            LOG.errorf(e, "Failed to send error notification");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while sending error notification");
            return false;
        }
    }

    private BatchStatusType deliverBatch(NotificationBatchType batch, NotificationChannel channel, int maxAttempts,
            CancellationSignal cancellation) {
        int index = batch.batchIndex();
        int size = batch.items().size();

        if (Thread.currentThread().isInterrupted()) {
            return BatchStatusType.failure(index, size, 0, "interrupted");
        }
        if (cancellation.isCancelled()) {
            return BatchStatusType.failure(index, size, 0, "cancelled: " + cancellation.reason());
        }

        int attempts = 0;
        try {
            if (!batch.isFirst()) {
                sleeper.sleep(config.slack().batchPause());
            }

            ObjectNode payload = renderer.render(batch);

            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                if (cancellation.isCancelled()) {
                    return BatchStatusType.failure(index, size, attempts, "cancelled: " + cancellation.reason());
                }

                boolean lastAttempt = attempt + 1 == maxAttempts;
                attempts++;

                ChannelResponseType response;
                try {
                    response = channel.send(payload);
                } catch (IOException e) {
                    attemptTransportErrorCounter.increment();
                    LOG.warnf("Send attempt %d/%d failed: error=%s", attempts, maxAttempts, e.toString());
                    if (lastAttempt) {
                        return BatchStatusType.failure(index, size, attempts, "transport error: " + e);
                    }
                    sleeper.sleep(Duration.ofSeconds(1L << attempt));
                    continue;
                }

                if (response.isSuccess()) {
                    attemptSuccessCounter.increment();
                    return BatchStatusType.success(index, size, attempts);
                }

                if (response.isRateLimited()) {
                    attemptRateLimitedCounter.increment();
                    Duration wait = retryDelay(response.retryAfter());
                    LOG.warnf("Rate limited on attempt %d/%d: retryAfter=%ss", attempts, maxAttempts,
                            wait.toSeconds());
                    if (lastAttempt) {
                        return BatchStatusType.failure(index, size, attempts, "rate limited");
                    }
                    sleeper.sleep(wait);
                    continue;
                }

                attemptRejectedCounter.increment();
                return BatchStatusType.failure(index, size, attempts, "HTTP " + response.statusCode());
            }

            return BatchStatusType.failure(index, size, attempts, "retries exhausted");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted while delivering batch %d", index + 1);
            return BatchStatusType.failure(index, size, attempts, "interrupted");
        }
    }

    /**
     * Resolves the wait before retrying a rate-limited send.
     */
    Duration retryDelay(Duration serverRetryAfter) {
        Duration wait = serverRetryAfter != null ? serverRetryAfter : config.slack().defaultRetryAfter();
        Duration ceiling = config.slack().maxRetryAfter();
        return wait.compareTo(ceiling) > 0 ? ceiling : wait;
    }

    /**
     * Initializes Micrometer metrics on first invocation.
     */
    private void initializeMetrics() {
        if (batchSuccessCounter == null) {
            batchSuccessCounter = Counter.builder("digest.dispatch.batches.total").tag("status", "success")
                    .description("Notification batches delivered").register(meterRegistry);
            batchFailureCounter = Counter.builder("digest.dispatch.batches.total").tag("status", "failure")
                    .description("Notification batches that could not be delivered").register(meterRegistry);
        }

        if (attemptSuccessCounter == null) {
            attemptSuccessCounter = attemptCounter("success");
            attemptRateLimitedCounter = attemptCounter("rate_limited");
            attemptTransportErrorCounter = attemptCounter("transport_error");
            attemptRejectedCounter = attemptCounter("rejected");
        }
    }

    private Counter attemptCounter(String outcome) {
        return Counter.builder("digest.dispatch.attempts.total").tag("outcome", outcome)
                .description("Notification send attempts by outcome").register(meterRegistry);
    }
}
