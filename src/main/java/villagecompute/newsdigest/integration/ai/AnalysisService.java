/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.integration.ai;

import villagecompute.newsdigest.exceptions.AnalysisServiceException;

/**
 * External text-generation service that analyzes one article per call.
 *
 * <p>
 * Implementations return the raw structured text produced by the model; validation into a typed result is done by
 * {@link villagecompute.newsdigest.services.AnalysisResponseParser}.
 */
public interface AnalysisService {

    /**
     * Sends one analysis request.
     *
     * @param instructions
     *            system instructions, including the JSON shape the response must follow
     * @param prompt
     *            the rendered article prompt
     * @return raw model output
     * @throws AnalysisServiceException
     *             on timeout, non-2xx response or transport failure
     */
    String analyze(String instructions, String prompt);
}
