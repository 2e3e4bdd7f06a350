/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * A configured RSS/Atom feed.
 *
 * @param name
 *            display name, used as the item source label
 * @param url
 *            feed URL
 * @param enabled
 *            disabled feeds are not fetched
 */
public record FeedSourceType(String name, String url, boolean enabled) {
}
