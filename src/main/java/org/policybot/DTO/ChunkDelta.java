package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一次文档重建对分块的影响。同序号覆盖计为 updated。
 */
@Data
@AllArgsConstructor
public class ChunkDelta {

    public static final ChunkDelta NONE = new ChunkDelta(0, 0, 0);

    private int created;
    private int updated;
    private int deleted;

    public static ChunkDelta of(int previousCount, int newCount) {
        return new ChunkDelta(
                Math.max(0, newCount - previousCount),
                Math.min(previousCount, newCount),
                Math.max(0, previousCount - newCount));
    }
}
