package com.weiwo.bridge.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * 知识库接口 WebClient 配置
 */
@Configuration
public class WebClientConfig {

    public static final String API_KEY_HEADER = "X-API-Key";

    @Autowired
    private ApplicationProperties applicationProperties;

    /**
     * 知识库接口专用 WebClient，统一携带 API Key 与超时
     */
    @Bean
    public WebClient knowledgeWebClient() {
        ApplicationProperties.Api apiConfig = applicationProperties.getApi();

        // 配置连接池
        ConnectionProvider connectionProvider = ConnectionProvider.builder("knowledge-api")
                .maxConnections(apiConfig.getMaxConnections())
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofSeconds(60))
                .pendingAcquireTimeout(Duration.ofSeconds(60))
                .evictInBackground(Duration.ofSeconds(120))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) apiConfig.getConnectTimeout().toMillis())
                .responseTimeout(apiConfig.getResponseTimeout())
                .keepAlive(true);

        return WebClient.builder()
                .baseUrl(apiConfig.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(headers -> {
                    if (apiConfig.getApiKey() != null && !apiConfig.getApiKey().isEmpty()) {
                        headers.add(API_KEY_HEADER, apiConfig.getApiKey());
                    }
                })
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(apiConfig.getMaxInMemorySize()))
                .build();
    }
}
