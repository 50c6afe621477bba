package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// 检索命中的分块，score 为余弦相似度
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoredChunk {
    private String id;
    private String documentId;
    private String filePath;
    private String title;
    private String textContent;
    private String url;
    private String lang;
    private Integer seq;
    private double score;
}
