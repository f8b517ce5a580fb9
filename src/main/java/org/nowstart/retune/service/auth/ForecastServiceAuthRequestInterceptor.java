package org.nowstart.retune.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ForecastServiceAuthRequestInterceptor implements RequestInterceptor {

    private final String apiToken;

    @Override
    public void apply(RequestTemplate template) {
        if (apiToken != null && !apiToken.isBlank()) {
            template.header("Authorization", "Bearer " + apiToken.trim());
        }
        template.header("Accept", "application/json");
        template.header("User-Agent", "retune-optimizer/1.0");
    }
}
