package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 单次查询计算出的记忆上下文，不落库。recentMessages 按时间正序。
 */
@Data
@AllArgsConstructor
public class MemoryContext {
    private String summary;
    private List<Message> recentMessages;
    private int totalTokens;

    public static MemoryContext empty() {
        return new MemoryContext(null, List.of(), 0);
    }
}
