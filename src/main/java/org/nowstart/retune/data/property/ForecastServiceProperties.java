package org.nowstart.retune.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.forecast-service")
public record ForecastServiceProperties(
        // forecasting service REST base URL
        @NotBlank @DefaultValue("http://localhost:8090") String baseUrl,
        // bearer token, empty for unauthenticated access
        @DefaultValue("") String apiToken,
        @NotNull @DefaultValue("5s") Duration connectTimeout,
        @NotNull @DefaultValue("60s") Duration readTimeout
) {
}
