package org.policybot.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "chat_messages", indexes = {
        @Index(name = "idx_chat_id", columnList = "chat_id")
})
public class ChatMessage {

    public enum Role {
        USER, ASSISTANT;

        public String apiName() {
            return name().toLowerCase();
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "chat_id", nullable = false, length = 64)
    private String chatId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(columnDefinition = "TEXT")
    private String sources; // 引用来源 JSON，仅助手消息

    @Column(name = "search_score")
    private Double searchScore;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public static ChatMessage of(String chatId, Role role, String text) {
        ChatMessage message = new ChatMessage();
        message.setChatId(chatId);
        message.setRole(role);
        message.setText(text);
        return message;
    }
}
