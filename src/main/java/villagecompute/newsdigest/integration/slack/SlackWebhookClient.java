/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.slack;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.ChannelResponseType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.exceptions.ConfigurationException;

/**
 * Slack incoming-webhook client.
 *
 * <p>
 * Posts Block Kit payloads with a per-request timeout taken from {@code newsdigest.slack.request-timeout}. Rate-limit
 * responses (HTTP 429) are returned with their {@code Retry-After} header parsed as seconds so the dispatcher can wait
 * the requested time.
 *
 * <p>
 * The webhook URL is validated at startup; a missing or malformed URL aborts the run before any network call.
 */
@ApplicationScoped
@Startup
public class SlackWebhookClient implements NotificationChannel {

    private static final Logger LOG = Logger.getLogger(SlackWebhookClient.class);

    @Inject
    NewsDigestConfig config;

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public SlackWebhookClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Rejects a blank or non-HTTP webhook URL.
     *
     * @throws ConfigurationException
     *             if the webhook URL is unusable
     */
    @PostConstruct
    public void validateConfiguration() {
        String webhookUrl = config.slack().webhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            String errorMessage = "SLACK_WEBHOOK_URL environment variable is not configured. "
                    + "Digest delivery requires a Slack incoming webhook URL.";
            LOG.fatal(errorMessage);
            throw new ConfigurationException(errorMessage);
        }

        URI uri;
        try {
            uri = URI.create(webhookUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("SLACK_WEBHOOK_URL is not a valid URI", e);
        }
        if (uri.getScheme() == null
                || !(uri.getScheme().equalsIgnoreCase("https") || uri.getScheme().equalsIgnoreCase("http"))) {
            throw new ConfigurationException("SLACK_WEBHOOK_URL must be an http(s) URL");
        }
    }

    @Override
    public ChannelResponseType send(JsonNode payload) throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(payload);

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(config.slack().webhookUrl().trim()))
                .timeout(config.slack().requestTimeout()).header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();

        HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        Duration retryAfter = parseRetryAfter(response.headers().firstValue("Retry-After").orElse(null));

        LOG.debugf("Slack webhook responded: status=%d, retryAfter=%s", response.statusCode(), retryAfter);
        return new ChannelResponseType(response.statusCode(), retryAfter, response.body());
    }

    /**
     * Parses a {@code Retry-After} header given in seconds.
     *
     * @param header
     *            raw header value, may be null
     * @return the delay, or null when the header is absent, negative or not a number
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric Retry-After header: %s", header);
            return null;
        }
    }
}
