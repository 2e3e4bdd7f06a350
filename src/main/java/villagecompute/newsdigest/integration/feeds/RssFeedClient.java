/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.feeds;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jsoup.Jsoup;

import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.FeedSourceType;
import villagecompute.newsdigest.config.NewsDigestConfig;

/**
 * Fetches RSS/Atom feeds and converts their entries into {@link FeedItemType} records.
 *
 * <p>
 * <b>Execution Flow (per feed):</b>
 * <ol>
 * <li>Fetch feed XML via HTTP with a 15-second request timeout</li>
 * <li>Parse with Rome Tools {@link SyndFeedInput}</li>
 * <li>Take the first {@code articles-per-feed} entries</li>
 * <li>Strip HTML from title and body with Jsoup, cap the body at {@value #MAX_BODY_LENGTH} characters</li>
 * <li>Drop entries without a title or link</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b> Network timeout, HTTP 4xx/5xx, invalid XML and parse errors are logged per feed. A failing
 * feed contributes no items; the remaining feeds are still fetched.
 */
@ApplicationScoped
public class RssFeedClient {

    private static final Logger LOG = Logger.getLogger(RssFeedClient.class);

    static final int MAX_BODY_LENGTH = 800;

    private static final String USER_AGENT = "NewsDigest/1.0";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private static final DateTimeFormatter PUBLISHED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    @Inject
    NewsDigestConfig config;

    private final HttpClient httpClient;

    public RssFeedClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    /**
     * Fetches every enabled feed from configuration.
     *
     * @return items from all feeds, feed by feed in configuration order
     */
    public List<FeedItemType> fetchConfigured() {
        List<FeedSourceType> feeds = config.feeds().stream()
                .map(feed -> new FeedSourceType(feed.name(), feed.url(), feed.enabled())).toList();
        return fetchAll(feeds, config.digest().articlesPerFeed());
    }

    /**
     * Fetches the given feeds.
     *
     * @param feeds
     *            feeds to fetch; disabled feeds are skipped
     * @param perFeedLimit
     *            maximum entries taken from each feed
     * @return items from all feeds that could be fetched
     */
    public List<FeedItemType> fetchAll(List<FeedSourceType> feeds, int perFeedLimit) {
        List<FeedSourceType> enabled = feeds.stream().filter(FeedSourceType::enabled).toList();
        if (enabled.isEmpty()) {
            LOG.warn("No enabled feeds configured");
            return List.of();
        }

        LOG.infof("Fetching %d feed(s)", enabled.size());

        List<FeedItemType> items = new ArrayList<>();
        int failureCount = 0;

        for (FeedSourceType feed : enabled) {
            try {
                List<FeedItemType> feedItems = fetchFeed(feed, perFeedLimit);
                items.addAll(feedItems);
                LOG.infof("Fetched feed %s: %d items", feed.name(), feedItems.size());
            } catch (Exception e) {
                failureCount++;
                LOG.errorf(e, "Failed to fetch feed %s (%s)", feed.name(), feed.url());
                // Continue with the remaining feeds
            }
        }

        LOG.infof("Feed fetch complete: %d items from %d feed(s), %d failed", items.size(),
                enabled.size() - failureCount, failureCount);
        return items;
    }

    /**
     * Fetches and parses a single feed.
     *
     * @param feed
     *            the feed to fetch
     * @param limit
     *            maximum entries to take
     * @return parsed items
     * @throws IOException
     *             on transport failure or non-200 status
     * @throws InterruptedException
     *             if interrupted while waiting for the response
     * @throws FeedException
     *             if the document is not a valid RSS/Atom feed
     */
    List<FeedItemType> fetchFeed(FeedSourceType feed, int limit)
            throws IOException, InterruptedException, FeedException {
        if (feed.url() == null || feed.url().isBlank()) {
            LOG.warnf("Feed %s has no URL - skipping", feed.name());
            return List.of();
        }

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(feed.url())).timeout(REQUEST_TIMEOUT)
                .header("User-Agent", USER_AGENT).GET().build();

        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

        if (response.statusCode() != 200) {
            response.body().close();
            throw new IOException(String.format("HTTP %d: %s", response.statusCode(), feed.url()));
        }

        SyndFeed parsed;
        try (InputStream inputStream = response.body()) {
            parsed = new SyndFeedInput().build(new XmlReader(inputStream));
        }

        List<SyndEntry> entries = parsed.getEntries();
        List<FeedItemType> items = new ArrayList<>();

        for (SyndEntry entry : entries.subList(0, Math.min(limit, entries.size()))) {
            String title = cleanHtml(entry.getTitle());
            String url = entry.getLink() != null ? entry.getLink().trim() : "";

            if (title.isBlank() || url.isBlank()) {
                LOG.debugf("Skipping entry with missing title/url: feed=%s", feed.name());
                continue;
            }

            String body = cleanHtml(extractBody(entry));
            if (body.length() > MAX_BODY_LENGTH) {
                body = body.substring(0, MAX_BODY_LENGTH);
            }

            items.add(new FeedItemType(title, url, body, feed.name(), formatPublished(entry)));
        }

        return items;
    }

    /**
     * Returns the entry description, falling back to its first content value.
     */
    private String extractBody(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null
                && !entry.getDescription().getValue().isBlank()) {
            return entry.getDescription().getValue();
        }
        if (entry.getContents() != null) {
            for (SyndContent content : entry.getContents()) {
                if (content.getValue() != null && !content.getValue().isBlank()) {
                    return content.getValue();
                }
            }
        }
        return "";
    }

    /**
     * Formats the published date, then the updated date, as {@code yyyy-MM-dd HH:mm} UTC.
     *
     * @return formatted timestamp, or an empty string when the entry carries no date
     */
    private String formatPublished(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? PUBLISHED_FORMAT.format(date.toInstant()) : "";
    }

    /**
     * Converts an HTML fragment to whitespace-normalized plain text.
     */
    static String cleanHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().trim();
    }
}
