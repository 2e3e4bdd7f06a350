/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.archive;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

import com.opencsv.CSVWriter;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.ArchiveEntryType;
import villagecompute.newsdigest.api.types.EnrichedItemType;
import villagecompute.newsdigest.config.NewsDigestConfig;
import villagecompute.newsdigest.exceptions.ArchiveException;

/**
 * Archive sink that writes one CSV sheet per run with OpenCSV.
 *
 * <p>
 * Files are named {@code <label>-<yyyyMMdd-HHmmss>.csv} inside {@code newsdigest.archive.directory}. Every row
 * carries the run timestamp; unenriched rows leave the analysis columns empty.
 */
@ApplicationScoped
public class CsvArchiveWriter implements ArchiveSink {

    private static final Logger LOG = Logger.getLogger(CsvArchiveWriter.class);

    static final String[] HEADERS = { "fetched_at", "title", "url", "source", "ai_summary", "score", "category",
            "original_summary", "published_at", "related_companies", "market_impact", "investment_insight" };

    static final int MAX_ORIGINAL_SUMMARY = 500;

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private static final DateTimeFormatter ROW_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Inject
    NewsDigestConfig config;

    ZoneId zone = ZoneId.systemDefault();

    @Override
    public String write(List<ArchiveEntryType> entries, Instant runAt, String runLabel) {
        Path directory = Path.of(config.archive().directory());
        String label = runLabel != null && !runLabel.isBlank() ? runLabel.replaceAll("[^A-Za-z0-9_-]", "_") : "run";
        Path file = directory.resolve(label + "-" + FILE_TIMESTAMP.format(runAt.atZone(zone)) + ".csv");
        String fetchedAt = ROW_TIMESTAMP.format(runAt.atZone(zone));

        try {
            Files.createDirectories(directory);
            try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
                writer.writeNext(HEADERS);
                for (ArchiveEntryType entry : entries) {
                    writer.writeNext(toRow(entry, fetchedAt));
                }
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to write archive file " + file, e);
        }

        LOG.infof("Archived %d entries to %s", entries.size(), file);
        return file.toString();
    }

    static String[] toRow(ArchiveEntryType entry, String fetchedAt) {
        String originalSummary = entry.item().body();
        if (originalSummary.length() > MAX_ORIGINAL_SUMMARY) {
            originalSummary = originalSummary.substring(0, MAX_ORIGINAL_SUMMARY);
        }

        return new String[] { fetchedAt, entry.item().title(), entry.item().url(), entry.item().source(),
                entry.analysisSummary(), entry.score() != null ? entry.score().toString() : "", entry.category(),
                originalSummary, entry.item().publishedAt(),
                entry.annotations().getOrDefault(EnrichedItemType.RELATED_COMPANIES, ""),
                entry.annotations().getOrDefault(EnrichedItemType.MARKET_IMPACT, ""),
                entry.annotations().getOrDefault(EnrichedItemType.INVESTMENT_INSIGHT, "") };
    }
}
