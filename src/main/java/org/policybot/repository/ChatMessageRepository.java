package org.policybot.repository;

import org.policybot.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * 按插入顺序倒序取最近的消息。
     *
     * @param chatId   会话 ID
     * @param pageable 取前 N 条
     * @return 从新到旧的消息
     */
    List<ChatMessage> findByChatIdOrderByIdDesc(String chatId, Pageable pageable);

    long countByChatId(String chatId);

    @Transactional
    @Modifying
    @Query(value = "DELETE FROM chat_messages WHERE chat_id = ?1", nativeQuery = true)
    int deleteAllByChatId(String chatId);
}
