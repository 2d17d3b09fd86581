package com.portfoliotrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Third-party historical data service, bound to {@code portfoliotrader.datafeed.*}.
 * Second in the bar source chain, after the broker's own history API.
 */
@Configuration
@ConfigurationProperties(prefix = "portfoliotrader.datafeed")
@Getter
@Setter
public class DatafeedConfig {

    private boolean enabled = false;

    private String url = "http://localhost:3020";

    /** HTTP connect timeout in milliseconds. */
    private int connectTimeout = 5000;

    /** HTTP read timeout in milliseconds. */
    private int readTimeout = 30000;

    @Bean
    public RestClient datafeedRestClient(RestClient.Builder restClientBuilder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return restClientBuilder.baseUrl(url).requestFactory(requestFactory).build();
    }
}
