package org.nowstart.retune.data.exception;

import org.springframework.http.HttpStatus;

public class HorizonBusyException extends OptimizerApiException {

    private HorizonBusyException(String code, String message) {
        super(HttpStatus.CONFLICT, code, message);
    }

    public static HorizonBusyException deployment(String horizon) {
        return new HorizonBusyException("deployment_busy", "Deployment already in progress for horizon=" + horizon);
    }

    public static HorizonBusyException pipeline(String horizon) {
        return new HorizonBusyException("pipeline_busy", "Optimization already running for horizon=" + horizon);
    }
}
