package org.nowstart.retune.data.exception;

import org.springframework.http.HttpStatus;

public class SignalUnavailableException extends OptimizerApiException {

    public SignalUnavailableException(String signal, String horizon, String reason) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "signal_unavailable",
                signal + " signal unavailable for horizon=" + horizon + ": " + reason);
    }

    public SignalUnavailableException(String signal, String horizon, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "signal_unavailable",
                signal + " signal unavailable for horizon=" + horizon, cause);
    }
}
