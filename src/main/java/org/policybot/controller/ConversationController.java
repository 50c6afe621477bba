package org.policybot.controller;

import org.policybot.DTO.MemoryContext;
import org.policybot.annotation.LogAction;
import org.policybot.config.RagProperties;
import org.policybot.entity.Conversation;
import org.policybot.service.ConversationService;
import org.policybot.service.SessionLockService;
import org.policybot.utils.Result;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 会话管理接口
 */
@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;
    private final SessionLockService sessionLockService;
    private final RagProperties ragProperties;

    public ConversationController(ConversationService conversationService, SessionLockService sessionLockService,
                                  RagProperties ragProperties) {
        this.conversationService = conversationService;
        this.sessionLockService = sessionLockService;
        this.ragProperties = ragProperties;
    }

    @GetMapping("/{chatId}/stats")
    @LogAction(value = "会话", action = "STATS")
    public ResponseEntity<Result<Map<String, Object>>> stats(@PathVariable String chatId) {
        return ResponseEntity.ok(Result.success(conversationService.stats(chatId)));
    }

    @PostMapping("/{chatId}/force-summary")
    @LogAction(value = "会话", action = "FORCE_SUMMARY")
    public ResponseEntity<Result<Map<String, Object>>> forceSummary(@PathVariable String chatId) {
        String summary = sessionLockService.withLock(chatId, () -> conversationService.forceSummary(chatId));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("chatId", chatId);
        data.put("summary", summary);
        return ResponseEntity.ok(Result.success(data));
    }

    @GetMapping("/{chatId}/context")
    @LogAction(value = "会话", action = "CONTEXT")
    public ResponseEntity<Result<MemoryContext>> context(@PathVariable String chatId,
                                                         @RequestParam(required = false) Integer maxTokens) {
        int budget = maxTokens != null ? maxTokens : ragProperties.getMemoryMaxTokens();
        return ResponseEntity.ok(Result.success(conversationService.buildContext(chatId, budget)));
    }

    @DeleteMapping("/{chatId}")
    @LogAction(value = "会话", action = "RESET")
    public ResponseEntity<Result<Map<String, Object>>> reset(@PathVariable String chatId) {
        Conversation conversation = sessionLockService.withLock(chatId, () -> conversationService.reset(chatId));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("chatId", chatId);
        data.put("messageCount", conversation.getMessageCount());
        data.put("hasSummary", conversation.getSummary() != null);
        return ResponseEntity.ok(Result.success("会话已重置", data));
    }
}
