package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.policybot.entity.Language;

import java.util.List;

/**
 * 检索结果：门槛判定 + 多样化后的证据
 */
@Data
@AllArgsConstructor
public class RetrievalResult {
    private List<ScoredChunk> evidence;
    private double topScore;
    private boolean sufficient;
    private Language lang;

    public static RetrievalResult insufficient(double topScore, Language lang) {
        return new RetrievalResult(List.of(), topScore, false, lang);
    }
}
