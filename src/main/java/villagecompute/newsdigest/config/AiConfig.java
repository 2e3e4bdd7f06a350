/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.config;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.newsdigest.exceptions.ConfigurationException;

/**
 * Configuration class for the LangChain4j analysis model (Anthropic Claude).
 *
 * <p>
 * This class performs startup validation to ensure the Anthropic API key is configured, then produces the
 * {@code analysis} ChatModel used by {@link villagecompute.newsdigest.integration.ai.AnthropicAnalysisClient}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code ai.anthropic.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code ai.model.name} - model name (default: claude-3-5-haiku-20241022)</li>
 * <li>{@code ai.model.temperature} - Sampling temperature (default: 0.3)</li>
 * <li>{@code ai.model.max-tokens} - Max output tokens (default: 2000)</li>
 * <li>{@code ai.model.timeout-seconds} - Request timeout (default: 60)</li>
 * <li>{@code ai.model.max-retries} - Client-level retry attempts (default: 1)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "ai.anthropic.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.model.name",
            defaultValue = "claude-3-5-haiku-20241022")
    String modelName;

    @ConfigProperty(
            name = "ai.model.temperature",
            defaultValue = "0.3")
    double temperature;

    @ConfigProperty(
            name = "ai.model.max-tokens",
            defaultValue = "2000")
    int maxTokens;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "60")
    int timeoutSeconds;

    @ConfigProperty(
            name = "ai.model.max-retries",
            defaultValue = "1")
    int maxRetries;

    /**
     * Fails startup with a descriptive message when the Anthropic API key is missing or blank.
     *
     * @throws ConfigurationException
     *             if the Anthropic API key is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.isEmpty() || apiKey.get().isBlank()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "Article analysis requires a valid Anthropic API key. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and rerun.";
            LOG.fatal(errorMessage);
            throw new ConfigurationException(errorMessage);
        }
        LOG.infof("LangChain4j analysis model configured: %s", modelName);
    }

    /**
     * Produces the ChatModel used for article analysis.
     *
     * @return configured Anthropic chat model
     */
    @Produces
    @ApplicationScoped
    @Named("analysis")
    public ChatModel createAnalysisModel() {
        LOG.infof("Creating analysis ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds, maxRetries=%d",
                modelName, temperature, maxTokens, timeoutSeconds, maxRetries);

        return AnthropicChatModel.builder().apiKey(apiKey.orElseThrow()).modelName(modelName)
                .temperature(temperature).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries).logRequests(false).logResponses(false).build();
    }
}
