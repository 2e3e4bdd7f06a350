/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.slack;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import villagecompute.newsdigest.api.types.AnalysisCategory;
import villagecompute.newsdigest.api.types.EnrichedItemType;
import villagecompute.newsdigest.api.types.NotificationBatchType;
import villagecompute.newsdigest.config.NewsDigestConfig;

/**
 * Renders notification batches as Slack Block Kit messages.
 *
 * <p>
 * <b>Message layout:</b>
 * <ol>
 * <li>Header with the digest title (batch counter appended when the digest spans several messages)</li>
 * <li>Context with run time, total story count and batch position</li>
 * <li>Per article: a section {@code *n. <url|title>*} followed by the summary, a context line with score, category
 * and source, and a divider between articles</li>
 * <li>Footer on the last batch only</li>
 * </ol>
 *
 * <p>
 * Slack rejects messages with more than {@value #MAX_BLOCKS_PER_MESSAGE} blocks. Each article takes
 * {@value #BLOCKS_PER_ITEM} blocks and the frame at most {@value #FRAME_BLOCKS}, which yields
 * {@link #maxItemsPerMessage()}.
 */
@ApplicationScoped
public class SlackMessageRenderer {

    public static final int MAX_BLOCKS_PER_MESSAGE = 50;

    public static final int BLOCKS_PER_ITEM = 3;

    public static final int FRAME_BLOCKS = 5;

    // Slack limits for section text and plain_text headers
    static final int MAX_SECTION_TEXT = 3000;
    static final int MAX_HEADER_TEXT = 150;
    static final int MAX_CONTEXT_LABEL = 100;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    @Inject
    public NewsDigestConfig config;

    @Inject
    public ObjectMapper objectMapper;

    Clock clock = Clock.systemDefaultZone();

    /**
     * Largest number of articles that fit in one Slack message.
     */
    public static int maxItemsPerMessage() {
        return (MAX_BLOCKS_PER_MESSAGE - FRAME_BLOCKS) / BLOCKS_PER_ITEM;
    }

    /**
     * Renders one batch.
     *
     * @param batch
     *            batch to render
     * @return Slack webhook payload with fallback {@code text} and {@code blocks}
     */
    public ObjectNode render(NotificationBatchType batch) {
        NewsDigestConfig.Slack slack = config.slack();
        String part = batch.totalBatches() > 1
                ? String.format(" (%d/%d)", batch.batchIndex() + 1, batch.totalBatches())
                : "";

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", String.format("%s - %d stories%s", slack.title(), batch.totalItemCount(), part));
        ArrayNode blocks = payload.putArray("blocks");

        addHeader(blocks, slack.title() + part);

        String runContext = String.format("*%s* • %d curated stories", ZonedDateTime.now(clock).format(TIMESTAMP),
                batch.totalItemCount());
        if (batch.totalBatches() > 1) {
            runContext += String.format(" • part %d of %d", batch.batchIndex() + 1, batch.totalBatches());
        }
        addContext(blocks, List.of(runContext));
        addDivider(blocks);

        List<EnrichedItemType> items = batch.items();
        for (int i = 0; i < items.size(); i++) {
            EnrichedItemType item = items.get(i);
            int rank = batch.startOffset() + i + 1;

            String text = String.format("*%d. <%s|%s>*\n%s", rank, escapeLinkTarget(item.url()),
                    escape(item.title()), escape(item.analysisSummary()));
            addSection(blocks, truncate(text, MAX_SECTION_TEXT));

            List<String> meta = new ArrayList<>();
            if (slack.showScore()) {
                meta.add(String.format("%s *%d/10*", scoreEmoji(item.score()), item.score()));
            }
            if (slack.showCategory()) {
                meta.add(AnalysisCategory.emojiFor(item.category()) + " "
                        + escape(truncate(item.category(), MAX_CONTEXT_LABEL)));
            }
            if (slack.showSource()) {
                String source = item.source().isBlank() ? "Unknown" : item.source();
                meta.add("🔗 " + escape(truncate(source, MAX_CONTEXT_LABEL)));
            }
            if (!meta.isEmpty()) {
                addContext(blocks, meta);
            }

            if (i < items.size() - 1) {
                addDivider(blocks);
            }
        }

        if (batch.isLast()) {
            addDivider(blocks);
            addContext(blocks, List.of("🤖 Generated automatically by News Digest"));
        }

        return payload;
    }

    /**
     * Renders a run failure notice.
     *
     * @param errorMessage
     *            error description
     * @return Slack webhook payload
     */
    public ObjectNode renderError(String errorMessage) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", "⚠️ News Digest run failed");
        ArrayNode blocks = payload.putArray("blocks");

        addHeader(blocks, "⚠️ News Digest run failed");
        String message = errorMessage != null ? errorMessage : "unknown error";
        addSection(blocks, "```" + truncate(escape(message), MAX_SECTION_TEXT - 6) + "```");
        addContext(blocks, List.of("Time: " + ZonedDateTime.now(clock).format(TIMESTAMP)));
        return payload;
    }

    static String scoreEmoji(int score) {
        if (score >= 8) {
            return "🔥";
        }
        return score >= 6 ? "⭐" : "📌";
    }

    /**
     * Escapes the three characters Slack mrkdwn treats as control characters.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String escapeLinkTarget(String url) {
        return url.replace("|", "%7C").replace(">", "%3E").replace("<", "%3C");
    }

    private static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 1) + "…";
    }

    private void addHeader(ArrayNode blocks, String text) {
        ObjectNode header = blocks.addObject();
        header.put("type", "header");
        ObjectNode headerText = header.putObject("text");
        headerText.put("type", "plain_text");
        headerText.put("text", truncate(text, MAX_HEADER_TEXT));
        headerText.put("emoji", true);
    }

    private void addSection(ArrayNode blocks, String mrkdwn) {
        ObjectNode section = blocks.addObject();
        section.put("type", "section");
        ObjectNode text = section.putObject("text");
        text.put("type", "mrkdwn");
        text.put("text", mrkdwn);
    }

    private void addContext(ArrayNode blocks, List<String> elements) {
        ObjectNode context = blocks.addObject();
        context.put("type", "context");
        ArrayNode array = context.putArray("elements");
        for (String element : elements) {
            ObjectNode node = array.addObject();
            node.put("type", "mrkdwn");
            node.put("text", element);
        }
    }

    private void addDivider(ArrayNode blocks) {
        blocks.addObject().put("type", "divider");
    }
}
