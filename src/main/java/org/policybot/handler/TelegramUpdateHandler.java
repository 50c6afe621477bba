package org.policybot.handler;

import org.policybot.DTO.ChatReply;
import org.policybot.DTO.RequestContext;
import org.policybot.DTO.TelegramUpdate;
import org.policybot.client.ChatTransport;
import org.policybot.entity.Conversation;
import org.policybot.entity.Language;
import org.policybot.service.ConversationService;
import org.policybot.service.SessionLockService;
import org.policybot.utils.LocalizedText;
import org.policybot.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Telegram 消息处理：命令直接回复，不写入会话消息；普通文本走问答流程。
 * 用户看到的错误只有本地化的致歉文案。
 */
@Component
public class TelegramUpdateHandler {

    private static final Logger logger = LoggerFactory.getLogger(TelegramUpdateHandler.class);

    private final ChatHandler chatHandler;
    private final ConversationService conversationService;
    private final SessionLockService sessionLockService;
    private final ChatTransport chatTransport;

    public TelegramUpdateHandler(ChatHandler chatHandler, ConversationService conversationService,
                                 SessionLockService sessionLockService, ChatTransport chatTransport) {
        this.chatHandler = chatHandler;
        this.conversationService = conversationService;
        this.sessionLockService = sessionLockService;
        this.chatTransport = chatTransport;
    }

    public void handle(TelegramUpdate update) {
        String chatId = update.getChatId();
        Language lang = currentLanguage(chatId);
        try {
            String reply = update.isCommand() ? handleCommand(update, lang) : handleQuestion(update);
            chatTransport.send(chatId, reply);
        } catch (Exception e) {
            LogUtils.logBusinessError("TELEGRAM", chatId, "消息处理失败", e);
            sendApology(chatId, lang);
        }
    }

    private String handleQuestion(TelegramUpdate update) {
        ChatReply reply = chatHandler.handle(RequestContext.of(update.getChatId(), "telegram"), update.getText(), null);
        return reply.getAnswer();
    }

    String handleCommand(TelegramUpdate update, Language lang) {
        String chatId = update.getChatId();
        switch (update.getCommandName()) {
            case "start":
            case "help":
                return LocalizedText.help(lang);
            case "reset":
                sessionLockService.withLock(chatId, () -> conversationService.reset(chatId));
                return LocalizedText.resetDone(lang);
            case "lang":
                Optional<Language> target = update.getCommandArgs().isEmpty()
                        ? Optional.empty()
                        : Language.parse(update.getCommandArgs().get(0));
                if (target.isEmpty()) {
                    return LocalizedText.languageUsage(lang);
                }
                sessionLockService.withLock(chatId, () -> conversationService.setLanguage(chatId, target.get()));
                return LocalizedText.languageChanged(target.get());
            default:
                return LocalizedText.unknownCommand(lang);
        }
    }

    private Language currentLanguage(String chatId) {
        return conversationService.find(chatId).map(Conversation::getLang).orElse(Language.KO);
    }

    private void sendApology(String chatId, Language lang) {
        try {
            chatTransport.send(chatId, LocalizedText.apology(lang));
        } catch (Exception sendError) {
            logger.error("致歉消息发送失败 => chatId: {}", chatId, sendError);
        }
    }
}
