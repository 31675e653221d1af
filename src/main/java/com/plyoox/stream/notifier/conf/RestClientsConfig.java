package com.plyoox.stream.notifier.conf;

import feign.Client;
import feign.httpclient.ApacheHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Pooled client behind every Feign client (Twitch auth, Twitch Helix, bot).
 */
@Slf4j
@Configuration
public class RestClientsConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager connectionManager(@Value("${http.client.maxConnections:50}") int maxConnections,
                                                                @Value("${http.client.maxConnectionsPerRoute:20}") int maxConnectionsPerRoute,
                                                                @Value("${http.client.timeToLiveSec:900}") long timeToLiveSec) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager(timeToLiveSec, TimeUnit.SECONDS);
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);
        return connectionManager;
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient httpClient(PoolingHttpClientConnectionManager connectionManager,
                                          @Value("${http.client.connectTimeoutMs:2000}") int connectTimeout,
                                          @Value("${http.client.requestTimeoutMs:2000}") int requestTimeout,
                                          @Value("${http.client.socketTimeoutMs:5000}") int socketTimeout) {
        log.info("Create http client, connectTimeout {}, requestTimeout {}, socketTimeout {}", connectTimeout, requestTimeout, socketTimeout);
        RequestConfig defaultRequestConfig = RequestConfig.custom()
                .setConnectTimeout(connectTimeout)
                .setRedirectsEnabled(false)
                .setConnectionRequestTimeout(requestTimeout)
                .setSocketTimeout(socketTimeout)
                .build();
        return HttpClientBuilder.create()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(defaultRequestConfig)
                .build();
    }

    @Bean
    public Client feignClient(HttpClient httpClient) {
        return new ApacheHttpClient(httpClient);
    }
}
