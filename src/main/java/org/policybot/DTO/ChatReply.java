package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一轮问答的最终结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatReply {
    private String answer;
    private boolean hasEvidence;
    private List<SourceRef> sources;
    private String lang;
    private long processingTime;
}
