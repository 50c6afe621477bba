package org.policybot.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.policybot.DTO.Message;
import org.policybot.config.AiProperties;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Chat Completions 接口客户端，非流式
@Service
public class DeepSeekClient implements CompletionModel {

    private static final Logger logger = LoggerFactory.getLogger(DeepSeekClient.class);

    private final WebClient webClient;
    private final String model;
    private final ObjectMapper objectMapper;

    public DeepSeekClient(@Value("${deepseek.api.url}") String apiUrl,
                          @Value("${deepseek.api.key:}") String apiKey,
                          @Value("${deepseek.api.model}") String model,
                          ObjectMapper objectMapper) {
        WebClient.Builder builder = WebClient.builder().baseUrl(apiUrl);

        // 只有当 API key 不为空时才添加 Authorization header
        if (apiKey != null && !apiKey.trim().isEmpty()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        this.webClient = builder.build();
        this.model = model;
        this.objectMapper = objectMapper;
    }

    @Override
    public String complete(List<Message> messages, AiProperties.Generation generation) {
        Map<String, Object> request = buildRequest(messages, generation);
        try {
            String body = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(90));

            JsonNode node = objectMapper.readTree(body);
            String content = node.path("choices").path(0).path("message").path("content").asText("");
            if (content.isBlank()) {
                throw new CustomException("模型返回空内容", ErrorKind.MODEL, HttpStatus.BAD_GATEWAY);
            }
            return content.trim();
        } catch (CustomException e) {
            throw e;
        } catch (Exception e) {
            logger.error("模型调用失败: {}", e.getMessage());
            throw new CustomException("模型调用失败: " + e.getMessage(), ErrorKind.MODEL, HttpStatus.BAD_GATEWAY, e);
        }
    }

    private Map<String, Object> buildRequest(List<Message> messages, AiProperties.Generation gen) {
        logger.debug("构建请求，消息数：{}", messages.size());

        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("messages", messages.stream()
                .map(m -> Map.of("role", m.getRole(), "content", m.getContent()))
                .toList());
        request.put("stream", false);
        // 生成参数
        if (gen.getTemperature() != null) {
            request.put("temperature", gen.getTemperature());
        }
        if (gen.getTopP() != null) {
            request.put("top_p", gen.getTopP());
        }
        if (gen.getMaxTokens() != null) {
            request.put("max_tokens", gen.getMaxTokens());
        }
        return request;
    }
}
