package org.policybot.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// 嵌入向量生成客户端（OpenAI 兼容接口）
@Component
public class EmbeddingClient implements Embedder {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingClient.class);

    @Value("${embedding.api.model}")
    private String modelId;

    @Value("${embedding.api.batch-size:50}")
    private int batchSize;

    @Value("${embedding.api.dimension:1536}")
    private int dimension;

    private final WebClient webClient;

    private final ObjectMapper objectMapper;

    public EmbeddingClient(WebClient embeddingWebClient, ObjectMapper objectMapper) {
        this.webClient = embeddingWebClient;
        this.objectMapper = objectMapper;
    }

    /**
     * 调用 API 生成向量
     * @param texts 输入文本列表
     * @return 对应的向量列表
     */
    @Override
    public List<float[]> embed(List<String> texts) {
        logger.debug("开始生成向量，文本数量: {}", texts.size());
        List<float[]> allVectors = new ArrayList<>(texts.size());
        try {
            // 分批处理，避免请求体过大
            for (int i = 0; i < texts.size(); i += batchSize) {
                List<String> batch = texts.subList(i, Math.min(i + batchSize, texts.size()));
                String response = callApiOnce(batch);
                List<float[]> vectors = parseVectors(response);
                if (vectors.size() != batch.size()) {
                    throw new IllegalStateException("向量数量与输入不一致: " + vectors.size() + " != " + batch.size());
                }
                allVectors.addAll(vectors);
            }
            return allVectors;
        } catch (CustomException e) {
            throw e;
        } catch (Exception e) {
            throw new CustomException("向量服务调用失败: " + e.getMessage(), ErrorKind.EMBEDDING,
                    HttpStatus.SERVICE_UNAVAILABLE, e);
        }
    }

    private String callApiOnce(List<String> batch) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", modelId);
        requestBody.put("input", batch);
        requestBody.put("dimensions", dimension);
        requestBody.put("encoding_format", "float");

        return webClient.post()
                .uri("/embeddings")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                        .filter(e -> e instanceof WebClientResponseException.TooManyRequests
                                || e instanceof WebClientResponseException && ((WebClientResponseException) e).getStatusCode().is5xxServerError()))
                .block(Duration.ofSeconds(60));
    }

    List<float[]> parseVectors(String response) throws Exception {
        JsonNode data = objectMapper.readTree(response).get("data");
        if (data == null || !data.isArray()) {
            throw new IllegalStateException("API 响应格式错误: data 字段不存在或不是数组");
        }

        // 按 index 排序，保证与输入顺序一致
        float[][] ordered = new float[data.size()][];
        int position = 0;
        for (JsonNode item : data) {
            JsonNode embedding = item.get("embedding");
            if (embedding == null || !embedding.isArray()) {
                throw new IllegalStateException("API 响应缺少 embedding 字段");
            }
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < embedding.size(); i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            int index = item.has("index") ? item.get("index").asInt() : position;
            ordered[index] = vector;
            position++;
        }
        return List.of(ordered);
    }
}
