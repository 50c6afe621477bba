package org.policybot.client;

import org.policybot.DTO.Message;
import org.policybot.config.AiProperties;

import java.util.List;

/**
 * 回答生成模型
 */
public interface CompletionModel {

    String complete(List<Message> messages, AiProperties.Generation generation);
}
