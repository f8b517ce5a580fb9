package org.nowstart.retune.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class OptimizerApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public OptimizerApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public OptimizerApiException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
