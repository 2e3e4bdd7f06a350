/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * A single candidate article pulled from one of the configured feeds.
 *
 * <p>
 * Items are identified by {@code url}: two items carrying the same URL are the same article when the archive merges
 * enriched and unenriched entries. Null fields are normalized to empty strings so that downstream keyword matching and
 * rendering never need null checks.
 *
 * @param title
 *            article title with HTML removed
 * @param url
 *            canonical article link, used as identity key
 * @param body
 *            plain-text article summary used as analysis input (may be empty)
 * @param source
 *            feed display name
 * @param publishedAt
 *            formatted publish timestamp (may be empty)
 */
public record FeedItemType(String title, String url, String body, String source, String publishedAt) {

    public FeedItemType {
        title = title != null ? title : "";
        url = url != null ? url : "";
        body = body != null ? body : "";
        source = source != null ? source : "";
        publishedAt = publishedAt != null ? publishedAt : "";
    }
}
