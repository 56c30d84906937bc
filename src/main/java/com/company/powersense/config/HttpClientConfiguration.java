package com.company.powersense.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Outbound HTTP clients. Every call is bounded by connect and read timeouts.
 */
@Configuration
public class HttpClientConfiguration {

    @Bean
    @Qualifier("upstreamRestClient")
    public RestClient upstreamRestClient(RestClient.Builder builder, PowerSenseProperties properties) {
        PowerSenseProperties.Upstream upstream = properties.getUpstream();
        return builder
                .requestFactory(requestFactory(upstream.getConnectTimeout(), upstream.getReadTimeout()))
                .build();
    }

    @Bean
    @Qualifier("historyRestClient")
    public RestClient historyRestClient(RestClient.Builder builder, PowerSenseProperties properties) {
        return builder
                .requestFactory(requestFactory(properties.getUpstream().getConnectTimeout(),
                        properties.getHistory().getReadTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}
