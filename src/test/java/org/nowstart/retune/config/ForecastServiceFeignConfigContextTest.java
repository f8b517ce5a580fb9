package org.nowstart.retune.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.Request;
import feign.RequestInterceptor;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.nowstart.retune.data.property.ForecastServiceProperties;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.cloud.autoconfigure.RefreshAutoConfiguration;
import org.springframework.cloud.context.scope.refresh.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class ForecastServiceFeignConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(RefreshScopeTestConfig.class, ForecastServiceFeignConfig.class, ForecastServicePropsTestConfig.class)
            .withConfiguration(AutoConfigurations.of(RefreshAutoConfiguration.class));

    @Test
    void contextLoadsWithForecastServiceFeignConfig() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(RequestInterceptor.class);
            Request.Options options = context.getBean(Request.Options.class);
            assertThat(options.connectTimeoutMillis()).isEqualTo(2000);
            assertThat(options.readTimeoutMillis()).isEqualTo(30000);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class RefreshScopeTestConfig {

        @Bean
        RefreshScope refreshScope() {
            return new RefreshScope();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ForecastServicePropsTestConfig {

        @Bean
        ForecastServiceProperties forecastServiceProperties() {
            return new ForecastServiceProperties(
                    "http://forecast.local",
                    "token",
                    Duration.ofSeconds(2),
                    Duration.ofSeconds(30)
            );
        }
    }
}
