/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.api.types;

/**
 * Kind of news a digest run covers.
 *
 * <p>
 * The news type adds a domain hint to the analysis prompt and labels the run in the archive.
 */
public enum NewsType {

    AI("ai", "This is AI and technology news. Focus on the impact on technology stocks and the AI supply chain."),
    TW_STOCK("tw_stock",
            "This is Taiwan stock market news. Focus on Taiwan-listed companies and cite TWSE/TPEx codes "
                    + "(for example 2330 TSMC)."),
    US_STOCK("us_stock",
            "This is US stock market news. Focus on US-listed companies and cite tickers (for example NVDA, AAPL).");

    private final String label;
    private final String promptContext;

    NewsType(String label, String promptContext) {
        this.label = label;
        this.promptContext = promptContext;
    }

    /** Short label used to name archive files. */
    public String label() {
        return label;
    }

    public String promptContext() {
        return promptContext;
    }
}
