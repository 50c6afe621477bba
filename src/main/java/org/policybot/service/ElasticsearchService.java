package org.policybot.service;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.JsonData;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.policybot.DTO.ChunkPoint;
import org.policybot.DTO.ScoredChunk;
import org.policybot.entity.Language;
import org.policybot.exception.CustomException;
import org.policybot.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

// Elasticsearch 向量索引
@Service
public class ElasticsearchService implements VectorIndex {

    private static final Logger logger = LoggerFactory.getLogger(ElasticsearchService.class);

    static final String INDEX_NAME = "policy_chunks";

    private final ElasticsearchClient esClient;
    private final ObjectMapper objectMapper;

    @Value("${embedding.api.dimension:1536}") // 必须与模型输出一致
    private int dimension;

    private volatile boolean indexReady;

    public ElasticsearchService(ElasticsearchClient esClient, ObjectMapper objectMapper) {
        this.esClient = esClient;
        this.objectMapper = objectMapper;
    }

    /**
     * 批量写入，ID 相同的点被覆盖
     */
    @Override
    public void upsert(List<ChunkPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        logger.debug("开始批量写入向量点，数量: {}", points.size());
        try {
            ensureIndexExists();
            List<BulkOperation> bulkOperations = points.stream()
                    .map(point -> BulkOperation.of(op -> op.index(idx -> idx
                            .index(INDEX_NAME)
                            .id(point.getId())
                            .document(point)
                    )))
                    .toList();

            BulkResponse response = esClient.bulk(BulkRequest.of(b -> b.operations(bulkOperations)));

            if (response.errors()) {
                response.items().stream()
                        .filter(item -> item.error() != null)
                        .forEach(item -> logger.error("向量点 {} 写入失败: {}", item.id(), item.error().reason()));
                throw new CustomException("批量写入部分失败，请检查日志", ErrorKind.INDEX, HttpStatus.BAD_GATEWAY);
            }
            logger.debug("批量写入完成，数量: {}", points.size());
        } catch (CustomException e) {
            throw e;
        } catch (Exception e) {
            logger.error("批量写入失败，数量: {}", points.size(), e);
            throw new CustomException("批量写入失败: " + e.getMessage(), ErrorKind.INDEX, HttpStatus.BAD_GATEWAY, e);
        }
    }

    @Override
    public long delete(String documentId, int fromSeq) {
        try {
            ensureIndexExists();
            DeleteByQueryRequest request = DeleteByQueryRequest.of(d -> d
                    .index(INDEX_NAME)
                    .refresh(true)
                    .query(q -> q.bool(b -> {
                        b.filter(f -> f.term(t -> t.field("documentId").value(documentId)));
                        if (fromSeq > 0) {
                            b.filter(f -> f.range(r -> r.field("seq").gte(JsonData.of(fromSeq))));
                        }
                        return b;
                    }))
            );
            DeleteByQueryResponse response = esClient.deleteByQuery(request);
            long deleted = response.deleted() == null ? 0 : response.deleted();
            logger.debug("删除向量点 => documentId: {}, fromSeq: {}, 数量: {}", documentId, fromSeq, deleted);
            return deleted;
        } catch (Exception e) {
            throw new CustomException("删除向量点失败: " + e.getMessage(), ErrorKind.INDEX, HttpStatus.BAD_GATEWAY, e);
        }
    }

    @Override
    public List<ScoredChunk> search(float[] vector, int k, Language lang, Double scoreThreshold) {
        List<Float> queryVector = new ArrayList<>(vector.length);
        for (float v : vector) {
            queryVector.add(v);
        }
        try {
            SearchResponse<ChunkPoint> response = esClient.search(s -> s
                    .index(INDEX_NAME)
                    .knn(kn -> {
                        kn.field("vector")
                                .queryVector(queryVector)
                                .k(k)
                                .numCandidates(Math.max(100, k * 10));
                        if (lang != null) {
                            kn.filter(f -> f.term(t -> t.field("lang").value(lang.code())));
                        }
                        return kn;
                    })
                    .source(src -> src.filter(f -> f.excludes("vector")))
                    .size(k), ChunkPoint.class);

            List<ScoredChunk> results = new ArrayList<>();
            for (Hit<ChunkPoint> hit : response.hits().hits()) {
                ChunkPoint point = hit.source();
                if (point == null || hit.score() == null) {
                    continue;
                }
                double cosine = toCosine(hit.score());
                if (scoreThreshold != null && cosine < scoreThreshold) {
                    continue;
                }
                results.add(new ScoredChunk(point.getId(), point.getDocumentId(), point.getFilePath(), point.getTitle(),
                        point.getTextContent(), point.getUrl(), point.getLang(), point.getSeq(), cosine));
            }
            logger.debug("向量检索完成，命中: {}, 过滤后: {}", response.hits().hits().size(), results.size());
            return results;
        } catch (Exception e) {
            throw new CustomException("向量检索失败: " + e.getMessage(), ErrorKind.INDEX, HttpStatus.BAD_GATEWAY, e);
        }
    }

    public boolean isAvailable() {
        try {
            return esClient.ping().value();
        } catch (IOException e) {
            logger.warn("Elasticsearch 不可达: {}", e.getMessage());
            return false;
        }
    }

    /**
     * cosine 相似度下 ES 返回的分数为 (1 + cos) / 2
     */
    static double toCosine(double esScore) {
        return 2 * esScore - 1;
    }

    /**
     * 确保索引存在，dense_vector 维度以配置为准
     */
    public void ensureIndexExists() throws IOException {
        if (indexReady) {
            return;
        }
        BooleanResponse exists = esClient.indices().exists(e -> e.index(INDEX_NAME));
        if (!exists.value()) {
            logger.info("索引 {} 不存在，正在创建，向量维度: {}", INDEX_NAME, dimension);
            String mapping = loadMapping();
            esClient.indices().create(c -> c
                    .index(INDEX_NAME)
                    .withJson(new StringReader(mapping)));
            logger.info("索引 {} 创建成功", INDEX_NAME);
        }
        indexReady = true;
    }

    private String loadMapping() throws IOException {
        ClassPathResource resource = new ClassPathResource("es-mappings/" + INDEX_NAME + ".json");
        try (InputStream is = resource.getInputStream()) {
            ObjectNode root = (ObjectNode) objectMapper.readTree(is);
            ((ObjectNode) root.path("mappings").path("properties").path("vector")).put("dims", dimension);
            return objectMapper.writeValueAsString(root);
        }
    }
}
