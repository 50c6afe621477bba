package org.policybot.service;

import org.policybot.DTO.RetrievalResult;
import org.policybot.DTO.ScoredChunk;
import org.policybot.client.Embedder;
import org.policybot.config.RagProperties;
import org.policybot.entity.Language;
import org.policybot.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 检索与证据门槛。
 * 候选池最高分低于门槛（含等号即通过）时判为证据不足，调用方不得调用回答模型；
 * 通过门槛后先过滤掉低于门槛的候选，再做多样化重排。
 */
@Service
public class RetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalService.class);

    private final Embedder embedder;
    private final VectorIndex vectorIndex;
    private final DiversityReranker reranker;
    private final RagProperties ragProperties;

    public RetrievalService(Embedder embedder, VectorIndex vectorIndex, DiversityReranker reranker,
                            RagProperties ragProperties) {
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.reranker = reranker;
        this.ragProperties = ragProperties;
    }

    public RetrievalResult retrieve(String query, Language lang) {
        return retrieve(query, lang, ragProperties.getTopK(), ragProperties.getMinScore());
    }

    public RetrievalResult retrieve(String query, Language lang, int k, double minScore) {
        List<ScoredChunk> candidates = candidates(query, lang, k);
        double topScore = candidates.stream().mapToDouble(ScoredChunk::getScore).max().orElse(0.0);

        if (candidates.isEmpty() || topScore < minScore) {
            logger.info("证据不足 => 候选数: {}, 最高分: {}, 门槛: {}", candidates.size(), topScore, minScore);
            return RetrievalResult.insufficient(topScore, lang);
        }

        List<ScoredChunk> evidence = diversify(candidates, minScore, k);
        logger.debug("检索完成 => 候选数: {}, 证据数: {}, 最高分: {}", candidates.size(), evidence.size(), topScore);
        return new RetrievalResult(evidence, topScore, true, lang);
    }

    /**
     * 不生成回答的检索：分数过滤 + 多样化
     */
    public List<ScoredChunk> search(String query, Language lang, int k, double minScore) {
        return diversify(candidates(query, lang, k), minScore, k);
    }

    private List<ScoredChunk> candidates(String query, Language lang, int k) {
        String normalized = TextUtils.normalizeWhitespace(query);
        if (normalized.isEmpty()) {
            return List.of();
        }
        float[] vector = embedder.embed(normalized);
        return vectorIndex.search(vector, k, lang, null);
    }

    private List<ScoredChunk> diversify(List<ScoredChunk> candidates, double minScore, int limit) {
        List<ScoredChunk> passing = candidates.stream()
                .filter(c -> c.getScore() >= minScore)
                .collect(Collectors.toList());
        return reranker.rerank(passing, ragProperties.getMmrLambda(), limit);
    }
}
