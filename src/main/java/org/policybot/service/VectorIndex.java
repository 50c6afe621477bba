package org.policybot.service;

import org.policybot.DTO.ChunkPoint;
import org.policybot.DTO.ScoredChunk;
import org.policybot.entity.Language;

import java.util.List;

/**
 * 向量索引能力。点 ID 确定（{documentId}_{seq}），重复写入即覆盖。
 */
public interface VectorIndex {

    void upsert(List<ChunkPoint> points);

    /**
     * 删除文档中序号 >= fromSeq 的点，fromSeq 为 0 时删除文档全部点
     *
     * @return 删除数量
     */
    long delete(String documentId, int fromSeq);

    /**
     * 相似度检索
     *
     * @param lang           语言过滤，null 表示不过滤
     * @param scoreThreshold 余弦相似度下限，null 表示不过滤
     */
    List<ScoredChunk> search(float[] vector, int k, Language lang, Double scoreThreshold);
}
