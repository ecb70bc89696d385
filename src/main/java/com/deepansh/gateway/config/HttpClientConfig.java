package com.deepansh.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind every outbound RestClient.
 *
 * Streams hold their connection for the whole completion, so the pool is sized for
 * many concurrent turns and the socket timeout stays generous: a model can pause
 * for a long time between chunks.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final int MAX_CONNECTIONS = 200;
    private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(10);
    private static final Timeout SOCKET_TIMEOUT = Timeout.ofMinutes(5);

    @Bean(destroyMethod = "close")
    public CloseableHttpClient gatewayHttpClient() {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(MAX_CONNECTIONS)
                .setMaxConnPerRoute(MAX_CONNECTIONS)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(CONNECT_TIMEOUT)
                        .setSocketTimeout(SOCKET_TIMEOUT)
                        .build())
                .build();

        log.info("HttpClient configured [maxConnections={}, socketTimeout={}]", MAX_CONNECTIONS, SOCKET_TIMEOUT);
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .evictExpiredConnections()
                .build();
    }

    @Bean
    public RestClient.Builder gatewayRestClientBuilder(CloseableHttpClient gatewayHttpClient) {
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(gatewayHttpClient));
    }
}
