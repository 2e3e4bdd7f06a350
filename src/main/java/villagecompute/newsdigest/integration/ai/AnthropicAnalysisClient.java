/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.ai;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.exceptions.AnalysisServiceException;

/**
 * {@link AnalysisService} backed by the LangChain4j Anthropic chat model.
 *
 * <p>
 * Timeouts and client-level retries are configured on the model itself (see
 * {@link villagecompute.newsdigest.config.AiConfig}). Any failure surfaced by LangChain4j is wrapped in
 * {@link AnalysisServiceException} so the enricher can skip the item.
 */
@ApplicationScoped
public class AnthropicAnalysisClient implements AnalysisService {

    private static final Logger LOG = Logger.getLogger(AnthropicAnalysisClient.class);

    @Inject
    @Named("analysis")
    ChatModel chatModel;

    @Override
    public String analyze(String instructions, String prompt) {
        try {
            ChatResponse response = chatModel.chat(SystemMessage.from(instructions), UserMessage.from(prompt));
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;

            if (response.tokenUsage() != null) {
                LOG.debugf("Analysis call complete: inputTokens=%s, outputTokens=%s",
                        response.tokenUsage().inputTokenCount(), response.tokenUsage().outputTokenCount());
            }
            return text;

        } catch (RuntimeException e) {
            throw new AnalysisServiceException("Analysis request failed: " + e.getMessage(), e);
        }
    }
}
