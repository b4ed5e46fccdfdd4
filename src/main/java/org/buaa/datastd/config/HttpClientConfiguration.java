package org.buaa.datastd.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP客户端配置, 用于向量模型API调用
 */
@Configuration
public class HttpClientConfiguration {

    @Value("${embedding.api.url}")
    private String embeddingApiUrl;

    @Value("${embedding.api.key:}")
    private String embeddingApiKey;

    /**
     * 创建用于向量编码的WebClient
     * 批量导入时请求体较大，放宽内存缓冲区
     */
    @Bean
    public WebClient embeddingWebClient() {
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(codecConfigurer -> codecConfigurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024))
            .build();

        WebClient.Builder builder = WebClient.builder()
            .baseUrl(embeddingApiUrl)
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (!embeddingApiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + embeddingApiKey);
        }
        return builder.build();
    }
}
