package org.nowstart.retune.data.exception;

import org.springframework.http.HttpStatus;

public class SearchExhaustedException extends OptimizerApiException {

    public SearchExhaustedException(String horizon, int failedCandidates) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "search_exhausted",
                "All " + failedCandidates + " candidates failed for horizon=" + horizon);
    }
}
