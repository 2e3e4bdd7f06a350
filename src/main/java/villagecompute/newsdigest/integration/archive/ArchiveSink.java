/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.archive;

import java.time.Instant;
import java.util.List;

import villagecompute.newsdigest.api.types.ArchiveEntryType;
import villagecompute.newsdigest.exceptions.ArchiveException;

/**
 * Tabular store that keeps every entry of a run, enriched or not.
 */
public interface ArchiveSink {

    /**
     * Stores one run.
     *
     * @param entries
     *            rows in archive order
     * @param runAt
     *            run timestamp, written on every row
     * @param runLabel
     *            category label of the run (news type)
     * @return a description of where the run was stored
     * @throws ArchiveException
     *             if the store cannot be written
     */
    String write(List<ArchiveEntryType> entries, Instant runAt, String runLabel);
}
