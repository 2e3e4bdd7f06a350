/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.slack;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;

import villagecompute.newsdigest.api.types.ChannelResponseType;

/**
 * Chat channel that accepts one rendered message per call.
 *
 * <p>
 * Any HTTP status is returned, not thrown; the caller decides what is retryable. Transport problems (connect failure,
 * request timeout) surface as {@link IOException}.
 */
public interface NotificationChannel {

    /**
     * Posts a rendered message.
     *
     * @param payload
     *            message JSON (Slack Block Kit)
     * @return status and optional retry-after hint
     * @throws IOException
     *             on timeout or transport failure
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting for the response
     */
    ChannelResponseType send(JsonNode payload) throws IOException, InterruptedException;
}
