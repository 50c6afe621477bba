package org.policybot.service;

import org.policybot.DTO.AnswerResult;
import org.policybot.DTO.MemoryContext;
import org.policybot.DTO.Message;
import org.policybot.DTO.RetrievalResult;
import org.policybot.DTO.ScoredChunk;
import org.policybot.DTO.SourceRef;
import org.policybot.client.CompletionModel;
import org.policybot.config.AiProperties;
import org.policybot.config.RagProperties;
import org.policybot.entity.Language;
import org.policybot.utils.LocalizedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组装有依据的 prompt，调用模型，并在回答后附上引用的规章
 */
@Service
public class AnswerService {

    private static final Logger logger = LoggerFactory.getLogger(AnswerService.class);

    private final CompletionModel completionModel;
    private final AiProperties aiProperties;
    private final RagProperties ragProperties;

    public AnswerService(CompletionModel completionModel, AiProperties aiProperties, RagProperties ragProperties) {
        this.completionModel = completionModel;
        this.aiProperties = aiProperties;
        this.ragProperties = ragProperties;
    }

    /**
     * 只接受通过证据门槛的检索结果
     */
    public AnswerResult answer(String question, RetrievalResult retrieval, MemoryContext memory, Language lang) {
        if (!retrieval.isSufficient()) {
            throw new IllegalArgumentException("证据不足时不能生成回答");
        }
        List<Message> messages = buildMessages(question, retrieval.getEvidence(), memory, lang);
        String raw = completionModel.complete(messages, aiProperties.getGeneration());

        List<SourceRef> sources = citedSources(retrieval.getEvidence());
        logger.debug("回答生成完成 => 长度: {}, 引用: {}", raw.length(), sources.size());
        return new AnswerResult(appendSources(raw, sources, lang), sources);
    }

    List<Message> buildMessages(String question, List<ScoredChunk> evidence, MemoryContext memory, Language lang) {
        AiProperties.Prompt prompt = aiProperties.getPrompt();
        StringBuilder system = new StringBuilder();

        // 1. 规则
        if (prompt.getRules() != null) {
            system.append(prompt.getRules().trim()).append("\n");
        }
        system.append("Answer in ").append(LocalizedText.languageName(lang)).append(".\n\n");

        // 2. 摘要（只作背景，不是证据）
        if (memory.getSummary() != null && !memory.getSummary().isBlank()) {
            system.append("[Conversation summary - background only, not evidence]\n")
                    .append(memory.getSummary().trim()).append("\n\n");
        }

        // 3. 最近几轮
        List<Message> recent = lastTurns(memory.getRecentMessages(), ragProperties.getPromptRecentTurns());
        if (!recent.isEmpty()) {
            system.append("[Recent conversation - background only, not evidence]\n");
            for (Message message : recent) {
                system.append(message.getRole()).append(": ").append(message.getContent()).append("\n");
            }
            system.append("\n");
        }

        // 4. 证据
        system.append(prompt.getEvidenceStart()).append("\n");
        for (int i = 0; i < evidence.size(); i++) {
            ScoredChunk chunk = evidence.get(i);
            system.append("[").append(i + 1).append("] ").append(chunk.getTitle())
                    .append(" (").append(chunk.getFilePath()).append(")\n")
                    .append(chunk.getTextContent())
                    .append("\n\n");
        }
        system.append(prompt.getEvidenceEnd()).append("\n\n");

        // 5. 重申约束
        if (prompt.getClosing() != null) {
            system.append(prompt.getClosing().trim());
        }

        List<Message> messages = new ArrayList<>();
        messages.add(new Message("system", system.toString()));
        messages.add(new Message("user", question));
        return messages;
    }

    /**
     * 一轮 = 一问一答，取最后 turns 轮
     */
    private List<Message> lastTurns(List<Message> messages, int turns) {
        int keep = Math.max(0, turns * 2);
        if (messages == null || messages.size() <= keep) {
            return messages == null ? List.of() : messages;
        }
        return messages.subList(messages.size() - keep, messages.size());
    }

    /**
     * 按文档去重，保持证据顺序，最多 maxCitedSources 条
     */
    List<SourceRef> citedSources(List<ScoredChunk> evidence) {
        Map<String, SourceRef> byDocument = new LinkedHashMap<>();
        for (ScoredChunk chunk : evidence) {
            if (byDocument.size() >= ragProperties.getMaxCitedSources()) {
                break;
            }
            String key = chunk.getUrl() != null ? chunk.getUrl() : chunk.getDocumentId();
            byDocument.putIfAbsent(key, new SourceRef(chunk.getTitle(), chunk.getUrl(), chunk.getFilePath(), chunk.getScore()));
        }
        return new ArrayList<>(byDocument.values());
    }

    private String appendSources(String answer, List<SourceRef> sources, Language lang) {
        if (sources.isEmpty()) {
            return answer;
        }
        StringBuilder sb = new StringBuilder(answer.trim());
        sb.append("\n\n").append(LocalizedText.sourcesHeader(lang));
        for (SourceRef source : sources) {
            sb.append("\n- ").append(source.getTitle());
            if (source.getUrl() != null) {
                sb.append(" (").append(source.getUrl()).append(")");
            }
        }
        return sb.toString();
    }
}
