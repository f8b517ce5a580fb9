package org.nowstart.retune.config;

import feign.Request;
import feign.RequestInterceptor;
import java.util.concurrent.TimeUnit;
import org.nowstart.retune.data.property.ForecastServiceProperties;
import org.nowstart.retune.service.auth.ForecastServiceAuthRequestInterceptor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ForecastServiceFeignConfig {

    @Bean
    @RefreshScope
    public RequestInterceptor forecastServiceAuthRequestInterceptor(ForecastServiceProperties forecastServiceProperties) {
        return new ForecastServiceAuthRequestInterceptor(forecastServiceProperties.apiToken());
    }

    @Bean
    public Request.Options forecastServiceRequestOptions(ForecastServiceProperties forecastServiceProperties) {
        return new Request.Options(
                forecastServiceProperties.connectTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                forecastServiceProperties.readTimeout().toMillis(),
                TimeUnit.MILLISECONDS,
                true
        );
    }
}
