package org.policybot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.policybot.DTO.RetrievalResult;
import org.policybot.DTO.ScoredChunk;
import org.policybot.client.Embedder;
import org.policybot.config.RagProperties;
import org.policybot.entity.Language;
import org.policybot.support.InMemoryVectorIndex;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.policybot.service.DiversityRerankerTest.chunk;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {

    @Mock
    private Embedder embedder;

    private InMemoryVectorIndex vectorIndex;
    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        vectorIndex = new InMemoryVectorIndex();
        lenient().when(embedder.embed(anyList())).thenReturn(List.of(new float[]{1f}));
        lenient().when(embedder.embed(anyString())).thenCallRealMethod();
        retrievalService = new RetrievalService(embedder, vectorIndex, new DiversityReranker(), new RagProperties());
    }

    @Test
    void topScoreBelowThresholdIsInsufficient() {
        vectorIndex.setSearchResults(List.of(chunk("a", "Leave", "annual leave", 0.75)));

        RetrievalResult result = retrievalService.retrieve("연차는 며칠인가요?", Language.EN);

        assertThat(result.isSufficient()).isFalse();
        assertThat(result.getEvidence()).isEmpty();
        assertThat(result.getTopScore()).isEqualTo(0.75);
    }

    @Test
    void scoreExactlyAtThresholdPasses() {
        vectorIndex.setSearchResults(List.of(chunk("a", "Leave", "annual leave", 0.80)));

        RetrievalResult result = retrievalService.retrieve("how many leave days?", Language.EN);

        assertThat(result.isSufficient()).isTrue();
        assertThat(result.getEvidence()).extracting(ScoredChunk::getId).containsExactly("a");
    }

    @Test
    void evidenceBelowThresholdIsDroppedBeforeDiversification() {
        vectorIndex.setSearchResults(List.of(
                chunk("a", "Leave", "annual leave", 0.91),
                chunk("b", "Travel", "travel expenses", 0.83),
                chunk("c", "Ethics", "gifts", 0.62)));

        RetrievalResult result = retrievalService.retrieve("leave", Language.EN);

        assertThat(result.isSufficient()).isTrue();
        assertThat(result.getTopScore()).isEqualTo(0.91);
        assertThat(result.getEvidence()).extracting(ScoredChunk::getId).containsExactly("a", "b");
    }

    @Test
    void noCandidatesIsInsufficient() {
        RetrievalResult result = retrievalService.retrieve("anything", Language.EN);

        assertThat(result.isSufficient()).isFalse();
        assertThat(result.getTopScore()).isZero();
    }

    @Test
    void blankQuerySkipsEmbeddingAndSearch() {
        RetrievalResult result = retrievalService.retrieve("   ", Language.KO);

        assertThat(result.isSufficient()).isFalse();
        verifyNoInteractions(embedder);
        assertThat(vectorIndex.getSearchCalls()).isZero();
    }

    @Test
    void searchAppliesCustomThreshold() {
        vectorIndex.setSearchResults(List.of(
                chunk("a", "Leave", "annual leave", 0.70),
                chunk("b", "Travel", "travel", 0.50)));

        List<ScoredChunk> hits = retrievalService.search("leave", Language.EN, 5, 0.6);

        assertThat(hits).extracting(ScoredChunk::getId).containsExactly("a");
    }
}
