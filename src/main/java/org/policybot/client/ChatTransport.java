package org.policybot.client;

/**
 * 聊天消息下发通道
 */
public interface ChatTransport {

    void send(String chatId, String text);
}
