package org.policybot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 检索、证据门槛和会话记忆参数
 */
@Component
@ConfigurationProperties(prefix = "rag")
@Data
public class RagProperties {
    /** 候选池大小 */
    private int topK = 6;
    /** 证据门槛（余弦相似度，含等号） */
    private double minScore = 0.80;
    /** MMR 相关性权重 */
    private double mmrLambda = 0.7;
    /** 记忆上下文 token 预算 */
    private int memoryMaxTokens = 1500;
    /** 组装上下文时最多读取的最近消息数 */
    private int maxRecentMessages = 20;
    /** 触发摘要的消息数 */
    private int summaryTriggerMessages = 10;
    /** 触发摘要的最近消息字符数 */
    private int summaryTriggerChars = 4000;
    /** prompt 中保留的最近轮数 */
    private int promptRecentTurns = 5;
    /** 回答末尾引用的最多来源数 */
    private int maxCitedSources = 3;
    private long sessionLockTtlSeconds = 120;
    private long sessionLockWaitMillis = 5000;
}
