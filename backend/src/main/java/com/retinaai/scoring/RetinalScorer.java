package com.retinaai.scoring;

import com.retinaai.exception.ExternalServiceException;

/**
 * External AI scorer. Its inference is opaque to the pipeline.
 */
public interface RetinalScorer {

    /**
     * Score one image with the thresholds of the model version the analysis runs under.
     *
     * @throws ExternalServiceException when the scorer is unreachable or answers with an error
     */
    ScoringOutcome score(String imageUrl, String thresholdConfig);
}
