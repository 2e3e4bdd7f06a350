/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.time.Duration;

/**
 * HTTP-style response from a notification channel.
 *
 * @param statusCode
 *            HTTP status code
 * @param retryAfter
 *            server-requested delay before retrying, or null when the server sent none
 * @param body
 *            response body, for logging
 */
public record ChannelResponseType(int statusCode, Duration retryAfter, String body) {

    /** Status a channel returns when the caller is rate limited. */
    public static final int TOO_MANY_REQUESTS = 429;

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }
}
