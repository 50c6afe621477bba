package org.policybot.service;

import org.policybot.DTO.MemoryContext;
import org.policybot.DTO.Message;
import org.policybot.client.CompletionModel;
import org.policybot.config.AiProperties;
import org.policybot.config.RagProperties;
import org.policybot.entity.ChatMessage;
import org.policybot.entity.Conversation;
import org.policybot.entity.Language;
import org.policybot.exception.CustomException;
import org.policybot.repository.ChatMessageRepository;
import org.policybot.repository.ConversationRepository;
import org.policybot.utils.LocalizedText;
import org.policybot.utils.LogUtils;
import org.policybot.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话记忆：会话生命周期、滚动摘要触发、按 token 预算组装上下文
 */
@Service
public class ConversationService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationService.class);

    private final ConversationRepository conversationRepository;
    private final ChatMessageRepository messageRepository;
    private final CompletionModel completionModel;
    private final RagProperties ragProperties;
    private final AiProperties aiProperties;

    public ConversationService(ConversationRepository conversationRepository,
                               ChatMessageRepository messageRepository,
                               CompletionModel completionModel,
                               RagProperties ragProperties,
                               AiProperties aiProperties) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.completionModel = completionModel;
        this.ragProperties = ragProperties;
        this.aiProperties = aiProperties;
    }

    public Conversation getOrCreate(String chatId, Language defaultLang) {
        return conversationRepository.findById(chatId).orElseGet(() -> {
            Conversation conversation = new Conversation();
            conversation.setChatId(chatId);
            conversation.setLang(defaultLang != null ? defaultLang : Language.KO);
            LogUtils.logBusiness("CONVERSATION_CREATE", chatId, "新建会话, 语言: %s", conversation.getLang().code());
            return conversationRepository.save(conversation);
        });
    }

    public Optional<Conversation> find(String chatId) {
        return conversationRepository.findById(chatId);
    }

    public Conversation setLanguage(String chatId, Language lang) {
        Conversation conversation = getOrCreate(chatId, lang);
        if (conversation.getLang() != lang) {
            conversation.setLang(lang);
            conversation = conversationRepository.save(conversation);
        }
        return conversation;
    }

    /**
     * 追加消息并检查摘要触发条件。摘要失败不影响消息写入。
     */
    public ChatMessage appendMessage(String chatId, ChatMessage.Role role, String text, String sources, Double score) {
        Conversation conversation = getOrCreate(chatId, null);

        ChatMessage message = ChatMessage.of(chatId, role, text);
        message.setSources(sources);
        message.setSearchScore(score);
        ChatMessage saved = messageRepository.save(message);

        conversation.setMessageCount(conversation.getMessageCount() + 1);
        conversation.setMessagesSinceSummary(conversation.getMessagesSinceSummary() + 1);
        conversation.setLastMessageAt(LocalDateTime.now());
        conversation = conversationRepository.save(conversation);

        if (shouldSummarize(conversation)) {
            summarize(conversation);
        }
        return saved;
    }

    /**
     * 摘要后新增消息数 >= N，或这些消息（最多最近 N 条）的字符数 >= C
     */
    boolean shouldSummarize(Conversation conversation) {
        int since = conversation.getMessagesSinceSummary();
        int trigger = ragProperties.getSummaryTriggerMessages();
        if (since <= 0) {
            return false;
        }
        if (since >= trigger) {
            return true;
        }
        List<ChatMessage> recent = messageRepository.findByChatIdOrderByIdDesc(conversation.getChatId(),
                PageRequest.of(0, Math.min(since, trigger)));
        int chars = recent.stream().mapToInt(m -> m.getText().length()).sum();
        return chars >= ragProperties.getSummaryTriggerChars();
    }

    /**
     * 用最近 N 条消息生成摘要，替换旧摘要。失败时保留旧摘要。
     *
     * @return 当前摘要
     */
    public String summarize(Conversation conversation) {
        String chatId = conversation.getChatId();
        List<ChatMessage> recent = new ArrayList<>(messageRepository.findByChatIdOrderByIdDesc(chatId,
                PageRequest.of(0, ragProperties.getSummaryTriggerMessages())));
        if (recent.isEmpty()) {
            return conversation.getSummary();
        }
        Collections.reverse(recent);

        try {
            String summary = completionModel.complete(summaryPrompt(conversation, recent), aiProperties.getSummary());
            if (summary == null || summary.isBlank()) {
                throw new IllegalStateException("模型返回空摘要");
            }
            summary = summary.trim();
            conversation.setSummary(summary);
            conversation.setSummaryUpdatedAt(LocalDateTime.now());
            conversation.setMessagesSinceSummary(0);
            conversationRepository.save(conversation);
            LogUtils.logBusiness("CONVERSATION_SUMMARY", chatId, "摘要已更新, 消息数: %d, 摘要长度: %d",
                    recent.size(), summary.length());
            return summary;
        } catch (Exception e) {
            logger.warn("会话摘要失败，保留旧摘要 => chatId: {}, error: {}", chatId, e.getMessage());
            return conversation.getSummary();
        }
    }

    public String forceSummary(String chatId) {
        return summarize(getOrCreate(chatId, null));
    }

    private List<Message> summaryPrompt(Conversation conversation, List<ChatMessage> recent) {
        StringBuilder transcript = new StringBuilder();
        if (conversation.getSummary() != null) {
            transcript.append("Previous summary:\n").append(conversation.getSummary()).append("\n\n");
        }
        transcript.append("Conversation:\n");
        for (ChatMessage message : recent) {
            transcript.append(message.getRole().apiName()).append(": ").append(message.getText()).append("\n");
        }

        String instruction = "Summarize the conversation between a user and a company policy assistant in 5-8 short lines, written in "
                + LocalizedText.languageName(conversation.getLang()) + ".\n"
                + "Keep the user's persistent intent, constraints and preferences, and facts confirmed by the regulations.\n"
                + "Drop greetings and small talk. Output only the summary.";
        List<Message> messages = new ArrayList<>();
        messages.add(new Message("system", instruction));
        messages.add(new Message("user", transcript.toString()));
        return messages;
    }

    /**
     * 按 token 预算组装记忆上下文：摘要先计入，再从新到旧加入消息，
     * 第一条放不下的消息及更早的消息全部丢弃。摘要本身超出预算时截断到预算内。
     */
    public MemoryContext buildContext(String chatId, int maxTokens) {
        Conversation conversation = conversationRepository.findById(chatId).orElse(null);
        if (conversation == null || maxTokens <= 0) {
            return MemoryContext.empty();
        }

        String summary = conversation.getSummary();
        if (summary != null && TextUtils.estimateTokens(summary) > maxTokens) {
            summary = summary.substring(0, Math.min(summary.length(), maxTokens * 4));
        }
        int total = TextUtils.estimateTokens(summary);

        List<ChatMessage> newestFirst = messageRepository.findByChatIdOrderByIdDesc(chatId,
                PageRequest.of(0, ragProperties.getMaxRecentMessages()));
        List<Message> selected = new ArrayList<>();
        for (ChatMessage message : newestFirst) {
            int tokens = TextUtils.estimateTokens(message.getText());
            if (total + tokens > maxTokens) {
                break;
            }
            selected.add(new Message(message.getRole().apiName(), message.getText()));
            total += tokens;
        }
        Collections.reverse(selected);
        return new MemoryContext(summary, selected, total);
    }

    public MemoryContext buildContext(String chatId) {
        return buildContext(chatId, ragProperties.getMemoryMaxTokens());
    }

    /**
     * 清空消息和摘要，保留会话记录
     */
    public Conversation reset(String chatId) {
        Conversation conversation = getOrCreate(chatId, null);
        int deleted = messageRepository.deleteAllByChatId(chatId);
        conversation.reset();
        Conversation saved = conversationRepository.save(conversation);
        LogUtils.logBusiness("CONVERSATION_RESET", chatId, "会话已重置, 删除消息: %d", deleted);
        return saved;
    }

    public Map<String, Object> stats(String chatId) {
        Conversation conversation = conversationRepository.findById(chatId)
                .orElseThrow(() -> CustomException.notFound("会话不存在: " + chatId));
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("chatId", chatId);
        stats.put("messageCount", conversation.getMessageCount());
        stats.put("messagesSinceSummary", conversation.getMessagesSinceSummary());
        stats.put("hasSummary", conversation.getSummary() != null);
        stats.put("lang", conversation.getLang().code());
        stats.put("lastMessageAt", conversation.getLastMessageAt());
        stats.put("createdAt", conversation.getCreatedAt());
        return stats;
    }
}
