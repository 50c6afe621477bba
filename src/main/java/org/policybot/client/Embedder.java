package org.policybot.client;

import java.util.List;

/**
 * 文本向量化能力
 */
public interface Embedder {

    /**
     * 批量生成向量，返回顺序与输入一致
     */
    List<float[]> embed(List<String> texts);

    default float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }
}
