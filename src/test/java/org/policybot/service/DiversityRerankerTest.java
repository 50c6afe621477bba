package org.policybot.service;

import org.junit.jupiter.api.Test;
import org.policybot.DTO.ScoredChunk;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiversityRerankerTest {

    private final DiversityReranker reranker = new DiversityReranker();

    @Test
    void topCandidateAlwaysComesFirst() {
        List<ScoredChunk> candidates = List.of(
                chunk("b", "Travel", "business travel expenses", 0.85),
                chunk("a", "Leave", "annual leave days", 0.92),
                chunk("c", "Ethics", "gifts and hospitality", 0.81));

        List<ScoredChunk> result = reranker.rerank(candidates, 0.7, 3);

        assertThat(result).extracting(ScoredChunk::getId).startsWith("a");
        assertThat(result).hasSize(3);
    }

    @Test
    void nearDuplicateIsPushedBehindDistinctEvidence() {
        List<ScoredChunk> candidates = List.of(
                chunk("a", "Leave", "annual leave is fifteen days per year", 0.92),
                chunk("a-copy", "Leave", "annual leave is fifteen days per year", 0.91),
                chunk("b", "Sick leave", "sick leave requires a medical certificate", 0.86));

        List<ScoredChunk> result = reranker.rerank(candidates, 0.7, 3);

        assertThat(result).extracting(ScoredChunk::getId).containsExactly("a", "b", "a-copy");
    }

    @Test
    void lambdaOneIsPureRelevanceOrder() {
        List<ScoredChunk> candidates = List.of(
                chunk("a", "Leave", "same text", 0.92),
                chunk("b", "Leave", "same text", 0.91),
                chunk("c", "Other", "different words entirely", 0.80));

        List<ScoredChunk> result = reranker.rerank(candidates, 1.0, 3);

        assertThat(result).extracting(ScoredChunk::getId).containsExactly("a", "b", "c");
    }

    @Test
    void respectsLimitAndEmptyInput() {
        List<ScoredChunk> candidates = List.of(
                chunk("a", "A", "alpha", 0.9),
                chunk("b", "B", "beta", 0.8));

        assertThat(reranker.rerank(candidates, 0.7, 1)).hasSize(1);
        assertThat(reranker.rerank(List.of(), 0.7, 3)).isEmpty();
    }

    @Test
    void similarityUsesTitleAndLeadingSnippetOnly() {
        String shared = "x ".repeat(150);
        ScoredChunk a = chunk("a", "Leave", shared + "tail one", 0.9);
        ScoredChunk b = chunk("b", "Leave", shared + "tail two", 0.9);

        assertThat(reranker.similarity(a, b)).isEqualTo(1.0);
    }

    static ScoredChunk chunk(String id, String title, String text, double score) {
        return new ScoredChunk(id, "doc-" + id, "policies/" + id + ".md", title, text,
                "https://example/" + id, "en", 0, score);
    }
}
