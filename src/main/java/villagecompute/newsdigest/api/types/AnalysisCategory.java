/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Categories the analysis prompt asks the model to choose from.
 *
 * <p>
 * The set is open at the rendering layer: labels outside this enum are kept on the enriched item and rendered with
 * {@link #UNKNOWN_EMOJI}.
 */
public enum AnalysisCategory {

    RESEARCH("🔬"), PRODUCT("🚀"), INDUSTRY("🏢"), MARKET("📈"),
    POLICY("⚖️"), OPINION("💭"), TUTORIAL("📚");

    /** Emoji used for labels that are not part of this enum. */
    public static final String UNKNOWN_EMOJI = "📄";

    private final String emoji;

    AnalysisCategory(String emoji) {
        this.emoji = emoji;
    }

    public String emoji() {
        return emoji;
    }

    /**
     * Looks up a category by label, ignoring case and surrounding whitespace.
     *
     * @param label
     *            label returned by the model
     * @return matching category, or empty for unrecognized labels
     */
    public static Optional<AnalysisCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (AnalysisCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the emoji for a label, falling back to {@link #UNKNOWN_EMOJI}.
     */
    public static String emojiFor(String label) {
        return fromLabel(label).map(AnalysisCategory::emoji).orElse(UNKNOWN_EMOJI);
    }
}
