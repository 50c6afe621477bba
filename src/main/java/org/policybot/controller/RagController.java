package org.policybot.controller;

import org.policybot.DTO.ChatReply;
import org.policybot.DTO.RagQueryRequest;
import org.policybot.DTO.RagSearchRequest;
import org.policybot.DTO.RequestContext;
import org.policybot.DTO.ScoredChunk;
import org.policybot.annotation.LogAction;
import org.policybot.config.RagProperties;
import org.policybot.entity.Language;
import org.policybot.exception.CustomException;
import org.policybot.handler.ChatHandler;
import org.policybot.service.RetrievalService;
import org.policybot.utils.Result;
import org.policybot.utils.TextUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/rag")
public class RagController {

    private static final int EXCERPT_LENGTH = 300;

    private final ChatHandler chatHandler;
    private final RetrievalService retrievalService;
    private final RagProperties ragProperties;

    public RagController(ChatHandler chatHandler, RetrievalService retrievalService, RagProperties ragProperties) {
        this.chatHandler = chatHandler;
        this.retrievalService = retrievalService;
        this.ragProperties = ragProperties;
    }

    /**
     * 完整问答：记忆 + 检索 + 证据门槛 + 回答 + 写入会话
     */
    @PostMapping("/query")
    @LogAction(value = "问答", action = "QUERY")
    public ResponseEntity<Result<ChatReply>> query(@RequestBody RagQueryRequest request) {
        if (request.getChatId() == null || request.getChatId().isBlank()) {
            throw CustomException.badRequest("chatId 不能为空");
        }
        if (request.getQuestion() == null || request.getQuestion().isBlank()) {
            throw CustomException.badRequest("question 不能为空");
        }
        Language lang = parseLang(request.getLang());
        ChatReply reply = chatHandler.handle(RequestContext.of(request.getChatId(), "api"), request.getQuestion().trim(), lang);
        return ResponseEntity.ok(Result.success(reply));
    }

    /**
     * 只检索不生成
     */
    @PostMapping("/search")
    @LogAction(value = "问答", action = "SEARCH")
    public ResponseEntity<Result<List<Map<String, Object>>>> search(@RequestBody RagSearchRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            throw CustomException.badRequest("query 不能为空");
        }
        int k = request.getK() != null && request.getK() > 0 ? request.getK() : ragProperties.getTopK();
        double minScore = request.getMinScore() != null ? request.getMinScore() : ragProperties.getMinScore();

        List<ScoredChunk> results = retrievalService.search(request.getQuery(), parseLang(request.getLang()), k, minScore);
        List<Map<String, Object>> data = results.stream().map(this::toView).collect(Collectors.toList());
        return ResponseEntity.ok(Result.success(data));
    }

    private Map<String, Object> toView(ScoredChunk chunk) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", chunk.getId());
        view.put("title", chunk.getTitle());
        view.put("filePath", chunk.getFilePath());
        view.put("url", chunk.getUrl());
        view.put("lang", chunk.getLang());
        view.put("score", chunk.getScore());
        view.put("excerpt", TextUtils.truncate(chunk.getTextContent(), EXCERPT_LENGTH));
        return view;
    }

    private Language parseLang(String lang) {
        if (lang == null || lang.isBlank()) {
            return null;
        }
        return Language.parse(lang).orElseThrow(() -> CustomException.badRequest("不支持的语言: " + lang));
    }
}
