package org.policybot.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class AnswerResult {
    private String text;          // 已附加来源列表的最终回答
    private List<SourceRef> sources;
}
