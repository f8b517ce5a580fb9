package org.nowstart.retune.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import feign.FeignException;
import feign.Request;
import feign.Response;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.retune.data.exception.DeploymentFailedException;
import org.nowstart.retune.data.exception.HorizonBusyException;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class OptimizerExceptionHandlerTest {

    private final OptimizerExceptionHandler handler = new OptimizerExceptionHandler();

    @Test
    void handleOptimizerApiException_mapsBusyToConflict() {
        ProblemDetail detail = handler.handleOptimizerApiException(HorizonBusyException.pipeline("7d"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
        assertThat(detail.getDetail()).contains("horizon=7d");
        assertThat(detail.getProperties()).containsEntry("code", "pipeline_busy");
    }

    @Test
    void handleOptimizerApiException_mapsMissingBackup() {
        ProblemDetail detail = handler.handleOptimizerApiException(DeploymentFailedException.noBackup("30d"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
        assertThat(detail.getProperties()).containsEntry("code", "no_backup");
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException(new IllegalStateException("boom"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }

    @Test
    void handleFeignException_includesUpstreamBodyAndStatus() {
        Request request = Request.create(
                Request.HttpMethod.GET,
                "/v1/horizons/7d/performance",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(404)
                .reason("Not Found")
                .request(request)
                .headers(Map.of())
                .body("{\"error\":\"unknown_horizon\"}", StandardCharsets.UTF_8)
                .build();
        FeignException exception = FeignException.errorStatus("ForecastServiceFeignClient#getPerformance", response);

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(detail.getDetail()).contains("unknown_horizon");
        assertThat(detail.getProperties()).containsEntry("code", "forecast_service_error");
        assertThat(detail.getProperties()).containsEntry("upstreamStatus", 404);
    }

    @Test
    void handleFeignException_fallsBackToBadGatewayWhenStatusUnknown() {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(-1);
        when(exception.contentUTF8()).thenReturn(" ");
        when(exception.getMessage()).thenReturn(" ");

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY.value());
        assertThat(detail.getDetail()).isEqualTo("Forecast service request failed");
    }

    @Test
    void handleValidationException_returnsValidationDetails() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ValidationTarget(), "target");
        bindingResult.addError(new FieldError("target", "reason", "reason must be at most 500 characters"));
        MethodParameter methodParameter = new MethodParameter(
                OptimizerExceptionHandlerTest.class.getDeclaredMethod("dummyValidationMethod", ValidationTarget.class),
                0
        );
        MethodArgumentNotValidException exception = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ProblemDetail detail = handler.handleValidationException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("reason must be at most 500 characters"));
    }

    @Test
    void handleConstraintViolationException_returnsValidationDetails() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = (ConstraintViolation<Object>) mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("horizon must match [A-Za-z0-9_-]+");

        ProblemDetail detail = handler.handleConstraintViolationException(new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("details", List.of("horizon must match [A-Za-z0-9_-]+"));
    }

    @SuppressWarnings("unused")
    private void dummyValidationMethod(ValidationTarget target) {
    }

    private static final class ValidationTarget {
        private String reason;
    }
}
