package org.policybot.service;

import org.policybot.DTO.ScoredChunk;
import org.policybot.utils.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * MMR 重排：最高分候选总是第一个入选，之后每轮选
 * λ·相关度 − (1−λ)·与已选结果的最大相似度 最大的候选。
 * 相似度为标题加摘录的 Jaccard 词重叠，用来压住近似重复的证据。
 */
@Component
public class DiversityReranker {

    static final int SNIPPET_CHARS = 200;

    public List<ScoredChunk> rerank(List<ScoredChunk> candidates, double lambda, int limit) {
        List<ScoredChunk> remaining = new ArrayList<>(candidates);
        remaining.sort(Comparator.comparingDouble(ScoredChunk::getScore).reversed());
        List<ScoredChunk> selected = new ArrayList<>();
        if (remaining.isEmpty() || limit <= 0) {
            return selected;
        }
        selected.add(remaining.remove(0));

        while (!remaining.isEmpty() && selected.size() < limit) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                ScoredChunk candidate = remaining.get(i);
                double redundancy = 0;
                for (ScoredChunk chosen : selected) {
                    redundancy = Math.max(redundancy, similarity(candidate, chosen));
                }
                double mmr = lambda * candidate.getScore() - (1.0 - lambda) * redundancy;
                if (mmr > bestScore) {
                    bestScore = mmr;
                    best = i;
                }
            }
            selected.add(remaining.remove(best));
        }
        return selected;
    }

    double similarity(ScoredChunk a, ScoredChunk b) {
        return TextUtils.jaccard(signature(a), signature(b));
    }

    private static String signature(ScoredChunk chunk) {
        String title = chunk.getTitle() == null ? "" : chunk.getTitle();
        String text = chunk.getTextContent() == null ? "" : chunk.getTextContent();
        String snippet = text.length() > SNIPPET_CHARS ? text.substring(0, SNIPPET_CHARS) : text;
        return title + " " + snippet;
    }
}
