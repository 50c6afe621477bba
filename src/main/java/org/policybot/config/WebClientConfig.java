package org.policybot.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

// 外部 HTTP 客户端
@Configuration
public class WebClientConfig {

    // 大文档内容和向量响应可能超过默认的 256KB
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient embeddingWebClient(@Value("${embedding.api.url}") String url,
                                        @Value("${embedding.api.key:}") String key) {
        return builder(url, Duration.ofSeconds(60))
                .defaultHeaders(h -> bearer(h, key))
                .build();
    }

    @Bean
    public WebClient githubWebClient(@Value("${github.api.url:https://api.github.com}") String url,
                                     @Value("${github.api.token:}") String token) {
        return builder(url, Duration.ofSeconds(30))
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .defaultHeaders(h -> bearer(h, token))
                .build();
    }

    @Bean
    public WebClient telegramWebClient(@Value("${telegram.bot.url:https://api.telegram.org}") String url) {
        return builder(url, Duration.ofSeconds(15)).build();
    }

    private WebClient.Builder builder(String baseUrl, Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(responseTimeout);
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build());
    }

    // 只有当 key 不为空时才添加 Authorization header
    private static void bearer(HttpHeaders headers, String key) {
        if (key != null && !key.trim().isEmpty()) {
            headers.setBearerAuth(key.trim());
        }
    }
}
