/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.newsdigest.TestFixtures;
import villagecompute.newsdigest.api.types.ChannelResponseType;
import villagecompute.newsdigest.api.types.DispatchResultType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.integration.slack.NotificationChannel;
import villagecompute.newsdigest.integration.slack.SlackMessageRenderer;
import villagecompute.newsdigest.util.CancellationSignal;

/**
 * Tests for batched delivery: partitioning, rate-limit handling, transport backoff, non-retryable statuses,
 * cancellation and interrupts.
 *
 * <p>
 * The channel is a scripted fake and sleeping is recorded instead of performed, so retry timing is asserted without
 * waiting.
 */
class SlackDispatchServiceTest {

    private SlackDispatchService service;
    private ScriptedChannel channel;
    private List<Duration> sleeps;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        NewsDigestConfig config = TestFixtures.config();

        SlackMessageRenderer renderer = new SlackMessageRenderer();
        renderer.config = config;
        renderer.objectMapper = new ObjectMapper();

        sleeps = new ArrayList<>();
        meterRegistry = new SimpleMeterRegistry();

        service = new SlackDispatchService();
        service.renderer = renderer;
        service.config = config;
        service.meterRegistry = meterRegistry;
        service.sleeper = sleeps::add;

        channel = new ScriptedChannel();
    }

    @AfterEach
    void tearDown() {
        // Clear any interrupt flag left by interrupt tests
        Thread.interrupted();
    }

    @Test
    void testDispatch_ThirtyTwoItemsInBatchesOfFifteen() {
        // Given
        channel.defaultResponse = ok();

        // When
        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(32, 8), channel, 15, 3,
                CancellationSignal.none());

        // Then
        assertTrue(result.allSucceeded());
        assertEquals(List.of(15, 15, 2), result.batches().stream().map(b -> b.itemCount()).toList());
        assertEquals(3, channel.payloads.size());
        assertEquals(32, result.deliveredItemCount());
        // Pause only between batches
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void testDispatch_BatchSizeClampedToMessageLimit() {
        channel.defaultResponse = ok();

        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(40, 8), channel, 100, 3,
                CancellationSignal.none());

        assertEquals(List.of(15, 15, 10), result.batches().stream().map(b -> b.itemCount()).toList());
        for (JsonNode payload : channel.payloads) {
            assertTrue(payload.get("blocks").size() <= SlackMessageRenderer.MAX_BLOCKS_PER_MESSAGE);
        }
    }

    @Test
    void testDispatch_RateLimitedThenSuccess() {
        // Given: 429 with Retry-After 5 then 200
        channel.script.add(new ChannelResponseType(429, Duration.ofSeconds(5), "rate_limited"));
        channel.script.add(ok());

        // When
        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(3, 8), channel, 15, 3,
                CancellationSignal.none());

        // Then
        assertTrue(result.allSucceeded());
        assertEquals(2, channel.payloads.size());
        assertEquals(2, result.batches().get(0).attempts());
        assertEquals(List.of(Duration.ofSeconds(5)), sleeps);
        assertTrue(sleeps.get(0).compareTo(Duration.ofSeconds(5)) >= 0);
    }

    @Test
    void testDispatch_RateLimitedWithoutHeaderUsesDefaultAndCapsLargeValues() {
        channel.script.add(new ChannelResponseType(429, null, ""));
        channel.script.add(new ChannelResponseType(429, Duration.ofSeconds(3600), ""));
        channel.script.add(ok());

        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(1, 8), channel, 15, 3,
                CancellationSignal.none());

        assertTrue(result.allSucceeded());
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(60)), sleeps);
    }

    @Test
    void testDispatch_RateLimitedOnLastAttemptFailsWithoutWaiting() {
        channel.defaultResponse = new ChannelResponseType(429, Duration.ofSeconds(5), "");

        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(1, 8), channel, 15, 2,
                CancellationSignal.none());

        assertFalse(result.allSucceeded());
        assertEquals(2, channel.payloads.size());
        assertEquals(List.of(Duration.ofSeconds(5)), sleeps);
        assertEquals("rate limited", result.batches().get(0).failureReason());
    }

    @Test
    void testDispatch_TimeoutBacksOffExponentially() {
        // Given: two timeouts then success
        channel.failures.add(new HttpTimeoutException("request timed out"));
        channel.failures.add(new HttpTimeoutException("request timed out"));
        channel.defaultResponse = ok();

        // When
        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(2, 8), channel, 15, 3,
                CancellationSignal.none());

        // Then
        assertTrue(result.allSucceeded());
        assertEquals(3, result.batches().get(0).attempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testDispatch_TransportErrorsExhaustRetries() {
        for (int i = 0; i < 3; i++) {
            channel.failures.add(new IOException("connection reset"));
        }

        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(2, 8), channel, 15, 3,
                CancellationSignal.none());

        assertFalse(result.allSucceeded());
        assertEquals(3, result.batches().get(0).attempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testDispatch_ServerErrorIsNotRetriedAndLaterBatchesContinue() {
        // Given: first batch rejected, second delivered
        channel.script.add(new ChannelResponseType(500, null, "internal_error"));
        channel.defaultResponse = ok();

        // When
        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(20, 8), channel, 15, 3,
                CancellationSignal.none());

        // Then
        assertFalse(result.allSucceeded());
        assertEquals(List.of(false, true), result.perBatchStatus());
        assertEquals(1, result.batches().get(0).attempts());
        assertEquals("HTTP 500", result.batches().get(0).failureReason());
        assertEquals(5, result.deliveredItemCount());
        assertEquals(1.0,
                meterRegistry.get("digest.dispatch.batches.total").tag("status", "failure").counter().count());
    }

    @Test
    void testDispatch_CancellationStopsRemainingBatches() {
        CancellationSignal cancellation = new CancellationSignal();
        channel.defaultResponse = ok();
        channel.onSend = () -> cancellation.cancel("shutdown");

        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(32, 8), channel, 15, 3, cancellation);

        assertEquals(List.of(true, false, false), result.perBatchStatus());
        assertEquals(1, channel.payloads.size());
        assertTrue(result.batches().get(1).failureReason().startsWith("cancelled"));
    }

    @Test
    void testDispatch_InterruptFailsRemainingBatchesAndRestoresFlag() {
        channel.defaultResponse = ok();
        service.sleeper = duration -> {
            throw new InterruptedException("interrupted");
        };

        DispatchResultType result = service.dispatch(TestFixtures.enrichedItems(32, 8), channel, 15, 3,
                CancellationSignal.none());

        assertEquals(List.of(true, false, false), result.perBatchStatus());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testDispatch_EmptyNotifySet() {
        DispatchResultType result = service.dispatch(List.of(), channel, 15, 3, CancellationSignal.none());

        assertTrue(result.allSucceeded());
        assertTrue(result.batches().isEmpty());
        assertTrue(channel.payloads.isEmpty());
    }

    @Test
    void testSendErrorNotification_SingleAttempt() {
        channel.defaultResponse = new ChannelResponseType(500, null, "");

        assertFalse(service.sendErrorNotification(channel, "boom"));
        assertEquals(1, channel.payloads.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testSendErrorNotification_TransportFailureReturnsFalse() {
        channel.failures.add(new IOException("connection refused"));

        assertFalse(service.sendErrorNotification(channel, "boom"));
    }

    private static ChannelResponseType ok() {
        return new ChannelResponseType(200, null, "ok");
    }

    /**
     * Channel that replays queued failures, then queued responses, then a default response.
     */
    private static class ScriptedChannel implements NotificationChannel {

        final Deque<IOException> failures = new ArrayDeque<>();
        final Deque<ChannelResponseType> script = new ArrayDeque<>();
        final List<JsonNode> payloads = new ArrayList<>();
        ChannelResponseType defaultResponse = new ChannelResponseType(200, null, "ok");
        Runnable onSend = () -> {
        };

        @Override
        public ChannelResponseType send(JsonNode payload) throws IOException {
            payloads.add(payload);
            onSend.run();
            if (!failures.isEmpty()) {
                throw failures.poll();
            }
            return script.isEmpty() ? defaultResponse : script.poll();
        }
    }
}
