package org.policybot.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.policybot.DTO.AnswerResult;
import org.policybot.DTO.ChatReply;
import org.policybot.DTO.MemoryContext;
import org.policybot.DTO.RequestContext;
import org.policybot.DTO.RetrievalResult;
import org.policybot.DTO.SourceRef;
import org.policybot.config.AiProperties;
import org.policybot.config.SyncProperties;
import org.policybot.entity.ChatMessage;
import org.policybot.entity.Conversation;
import org.policybot.entity.Language;
import org.policybot.service.AnswerService;
import org.policybot.service.ConversationService;
import org.policybot.service.RetrievalService;
import org.policybot.service.SessionLockService;
import org.policybot.utils.LogUtils;
import org.policybot.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 一轮问答：加载会话 -> 组装记忆 -> 写入用户消息 -> 检索 + 证据门槛 -> 生成回答 -> 写入助手消息。
 * 整轮在会话锁内执行。证据不足时返回固定文案，不调用模型。
 */
@Component
public class ChatHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChatHandler.class);

    private final ConversationService conversationService;
    private final RetrievalService retrievalService;
    private final AnswerService answerService;
    private final SessionLockService sessionLockService;
    private final AiProperties aiProperties;
    private final SyncProperties syncProperties;
    private final ObjectMapper objectMapper;

    public ChatHandler(ConversationService conversationService, RetrievalService retrievalService,
                       AnswerService answerService, SessionLockService sessionLockService,
                       AiProperties aiProperties, SyncProperties syncProperties, ObjectMapper objectMapper) {
        this.conversationService = conversationService;
        this.retrievalService = retrievalService;
        this.answerService = answerService;
        this.sessionLockService = sessionLockService;
        this.aiProperties = aiProperties;
        this.syncProperties = syncProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * @param requestedLang 调用方指定的语言；为空时按问题自动检测
     */
    public ChatReply handle(RequestContext context, String question, Language requestedLang) {
        String chatId = context.getChatId();
        LogUtils.setRequestContext(context.getRequestId(), chatId, null);
        LogUtils.logChat(chatId, "QUESTION", question.length());
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("CHAT_TURN");

        ChatReply reply = sessionLockService.withLock(chatId, () -> runTurn(chatId, question, requestedLang));
        reply.setProcessingTime(monitor.elapsed());
        monitor.end("证据: " + reply.isHasEvidence());
        return reply;
    }

    private ChatReply runTurn(String chatId, String question, Language requestedLang) {
        Language lang = resolveLanguage(chatId, question, requestedLang);

        // 记忆在写入本轮问题之前组装，本轮问题不重复出现在上下文里
        MemoryContext memory = conversationService.buildContext(chatId);
        conversationService.appendMessage(chatId, ChatMessage.Role.USER, question, null, null);

        RetrievalResult retrieval = retrievalService.retrieve(question, lang);
        if (!retrieval.isSufficient()) {
            String text = aiProperties.noEvidenceText(lang);
            conversationService.appendMessage(chatId, ChatMessage.Role.ASSISTANT, text, null, retrieval.getTopScore());
            LogUtils.logChat(chatId, "NO_EVIDENCE", text.length());
            return new ChatReply(text, false, List.of(), lang.code(), 0);
        }

        AnswerResult answer = answerService.answer(question, retrieval, memory, lang);
        conversationService.appendMessage(chatId, ChatMessage.Role.ASSISTANT, answer.getText(),
                toJson(answer.getSources()), retrieval.getTopScore());
        LogUtils.logChat(chatId, "ANSWER", answer.getText().length());
        return new ChatReply(answer.getText(), true, answer.getSources(), lang.code(), 0);
    }

    /**
     * 指定语言优先；否则检测问题语言，与会话设置不一致时更新会话
     */
    private Language resolveLanguage(String chatId, String question, Language requestedLang) {
        Conversation conversation = conversationService.getOrCreate(chatId, requestedLang);
        Language lang = requestedLang != null ? requestedLang
                : TextUtils.detectLanguage(question, syncProperties.getLangDetectPrefix(), syncProperties.getLangDetectRatio());
        if (conversation.getLang() != lang) {
            logger.debug("会话语言变更 => chatId: {}, {} -> {}", chatId, conversation.getLang(), lang);
            conversationService.setLanguage(chatId, lang);
        }
        return lang;
    }

    private String toJson(List<SourceRef> sources) {
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            logger.warn("来源序列化失败: {}", e.getMessage());
            return null;
        }
    }
}
