package org.nowstart.retune.data.exception;

import org.springframework.http.HttpStatus;

public class DeploymentFailedException extends OptimizerApiException {

    public DeploymentFailedException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "deployment_failed", message, cause);
    }

    private DeploymentFailedException(HttpStatus status, String code, String message) {
        super(status, code, message);
    }

    public static DeploymentFailedException noBackup(String horizon) {
        return new DeploymentFailedException(HttpStatus.CONFLICT, "no_backup",
                "No backup available to roll back horizon=" + horizon);
    }
}
