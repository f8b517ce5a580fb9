package org.nowstart.retune.data.exception;

import org.springframework.http.HttpStatus;

public class CandidateEvaluationException extends OptimizerApiException {

    public CandidateEvaluationException(String horizon, String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "candidate_evaluation_failed",
                "Candidate evaluation failed for horizon=" + horizon + ": " + message, cause);
    }
}
