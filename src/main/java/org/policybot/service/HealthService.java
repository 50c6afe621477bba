package org.policybot.service;

import org.policybot.repository.PolicyDocumentRepository;
import org.policybot.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * 依赖组件连通性检查：数据库、Redis、Elasticsearch
 */
@Service
public class HealthService {

    private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

    private final PolicyDocumentRepository documentRepository;
    private final RedisRepository redisRepository;
    private final ElasticsearchService elasticsearchService;
    private final long startTime = System.currentTimeMillis();

    public HealthService(PolicyDocumentRepository documentRepository, RedisRepository redisRepository,
                         ElasticsearchService elasticsearchService) {
        this.documentRepository = documentRepository;
        this.redisRepository = redisRepository;
        this.elasticsearchService = elasticsearchService;
    }

    public Map<String, Object> check() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("database", probe("database", () -> documentRepository.count() >= 0));
        services.put("redis", probe("redis", redisRepository::ping));
        services.put("elasticsearch", probe("elasticsearch", elasticsearchService::isAvailable));

        boolean healthy = services.values().stream().allMatch("connected"::equals);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", healthy ? "healthy" : "unhealthy");
        result.put("services", services);
        result.put("uptime", System.currentTimeMillis() - startTime);
        result.put("timestamp", LocalDateTime.now().toString());
        return result;
    }

    public boolean isHealthy(Map<String, Object> result) {
        return "healthy".equals(result.get("status"));
    }

    private String probe(String name, BooleanSupplier check) {
        try {
            return check.getAsBoolean() ? "connected" : "disconnected";
        } catch (Exception e) {
            logger.warn("健康检查失败 => {}: {}", name, e.getMessage());
            return "error";
        }
    }
}
