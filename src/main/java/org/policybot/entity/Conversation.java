package org.policybot.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "conversations")
public class Conversation {

    @Id
    @Column(name = "chat_id", length = 64)
    private String chatId; // 会话唯一标识（Telegram chat id 或 API 调用方传入）

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Language lang = Language.KO;

    @Column(columnDefinition = "TEXT")
    private String summary; // 滚动摘要，只保留一层

    @Column(name = "message_count", nullable = false)
    private int messageCount;

    @Column(name = "messages_since_summary", nullable = false)
    private int messagesSinceSummary;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;

    @Column(name = "summary_updated_at")
    private LocalDateTime summaryUpdatedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    /**
     * 清空摘要和计数，记录本身保留
     */
    public void reset() {
        summary = null;
        summaryUpdatedAt = null;
        messageCount = 0;
        messagesSinceSummary = 0;
    }
}
