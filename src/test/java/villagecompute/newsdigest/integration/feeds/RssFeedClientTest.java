/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.feeds;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.newsdigest.TestFixtures;
import villagecompute.newsdigest.WireMockTestBase;
import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.FeedSourceType;
import villagecompute.newsdigest.config.NewsDigestConfig;

/**
 * Tests for RSS retrieval and HTML cleanup against a WireMock feed server.
 */
class RssFeedClientTest extends WireMockTestBase {

    private RssFeedClient client;

    @BeforeEach
    void setUpClient() {
        client = new RssFeedClient();
        client.config = TestFixtures.config();
    }

    @Test
    void testFetchAll_ParsesAndCleansEntries() {
        // Given
        stubRssFeed("/ai.xml", "wiremock/rss/ai-news.xml");

        // When
        List<FeedItemType> items = client.fetchAll(List.of(new FeedSourceType("Example", baseUrl() + "/ai.xml", true)),
                15);

        // Then: the untitled entry is dropped
        assertEquals(3, items.size());

        FeedItemType first = items.get(0);
        assertEquals("OpenAI ships new reasoning model", first.title());
        assertEquals("https://news.example.com/openai-model", first.url());
        assertEquals("The new LLM improves math benchmarks.", first.body());
        assertEquals("Example", first.source());
        assertEquals("2025-01-15 08:30", first.publishedAt());

        FeedItemType second = items.get(1);
        assertEquals("Semiconductor stocks rose as AI demand grew.", second.body());
        assertEquals("", second.publishedAt());

        wireMockServer.verify(getRequestedFor(urlPathEqualTo("/ai.xml")).withHeader("User-Agent", equalTo(
                "NewsDigest/1.0")));
    }

    @Test
    void testFetchAll_RespectsPerFeedLimit() {
        stubRssFeed("/ai.xml", "wiremock/rss/ai-news.xml");

        List<FeedItemType> items = client.fetchAll(List.of(new FeedSourceType("Example", baseUrl() + "/ai.xml", true)),
                2);

        assertEquals(2, items.size());
    }

    @Test
    void testFetchAll_CapsBodyLength() {
        stubRssFeed("/long.xml", "wiremock/rss/long-body.xml");

        List<FeedItemType> items = client
                .fetchAll(List.of(new FeedSourceType("Long", baseUrl() + "/long.xml", true)), 15);

        assertEquals(RssFeedClient.MAX_BODY_LENGTH, items.get(0).body().length());
    }

    @Test
    void testFetchAll_FailingFeedDoesNotStopOthers() {
        // Given: one feed 500, one malformed, one valid
        wireMockServer.stubFor(get(urlPathEqualTo("/broken.xml")).willReturn(aResponse().withStatus(500)));
        wireMockServer.stubFor(get(urlPathEqualTo("/garbage.xml"))
                .willReturn(aResponse().withStatus(200).withBody("<html>not a feed")));
        stubRssFeed("/ai.xml", "wiremock/rss/ai-news.xml");

        // When
        List<FeedItemType> items = client.fetchAll(List.of(new FeedSourceType("Broken", baseUrl() + "/broken.xml", true),
                new FeedSourceType("Garbage", baseUrl() + "/garbage.xml", true),
                new FeedSourceType("Example", baseUrl() + "/ai.xml", true)), 15);

        // Then
        assertEquals(3, items.size());
        assertTrue(items.stream().allMatch(item -> item.source().equals("Example")));
    }

    @Test
    void testFetchAll_SkipsDisabledFeeds() {
        stubRssFeed("/ai.xml", "wiremock/rss/ai-news.xml");

        List<FeedItemType> items = client
                .fetchAll(List.of(new FeedSourceType("Example", baseUrl() + "/ai.xml", false)), 15);

        assertTrue(items.isEmpty());
        wireMockServer.verify(0, getRequestedFor(urlPathEqualTo("/ai.xml")));
    }

    @Test
    void testFetchConfigured_UsesConfiguredFeedsAndLimit() {
        stubRssFeed("/ai.xml", "wiremock/rss/ai-news.xml");
        NewsDigestConfig.Feed feed = mock(NewsDigestConfig.Feed.class);
        when(feed.name()).thenReturn("Configured");
        when(feed.url()).thenReturn(baseUrl() + "/ai.xml");
        when(feed.enabled()).thenReturn(true);
        when(client.config.feeds()).thenReturn(List.of(feed));
        when(client.config.digest().articlesPerFeed()).thenReturn(1);

        List<FeedItemType> items = client.fetchConfigured();

        assertEquals(1, items.size());
        assertEquals("Configured", items.get(0).source());
    }

    @Test
    void testCleanHtml() {
        String cleanText = RssFeedClient.cleanHtml("<p>Hello <strong>World</strong></p>");

        assertEquals("Hello World", cleanText);
        assertEquals("", RssFeedClient.cleanHtml(null));
    }
}
