package org.policybot.support;

import org.mockito.quality.Strictness;
import org.policybot.entity.ChatMessage;
import org.policybot.entity.Conversation;
import org.policybot.entity.DocumentChunk;
import org.policybot.entity.PolicyDocument;
import org.policybot.entity.SyncJob;
import org.policybot.entity.SyncWatermark;
import org.policybot.repository.ChatMessageRepository;
import org.policybot.repository.ConversationRepository;
import org.policybot.repository.DocumentChunkRepository;
import org.policybot.repository.PolicyDocumentRepository;
import org.policybot.repository.SyncJobRepository;
import org.policybot.repository.SyncWatermarkRepository;
import org.springframework.data.domain.Pageable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/**
 * 用 Map 支撑的 JPA repository 替身，只实现业务代码用到的方法
 */
public final class InMemoryRepositories {

    private InMemoryRepositories() {
    }

    private static <T> T lenientMock(Class<T> type) {
        return mock(type, withSettings().strictness(Strictness.LENIENT));
    }

    public static PolicyDocumentRepository documents(Map<String, PolicyDocument> store) {
        PolicyDocumentRepository repo = lenientMock(PolicyDocumentRepository.class);
        when(repo.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        when(repo.save(any(PolicyDocument.class))).thenAnswer(inv -> {
            PolicyDocument doc = inv.getArgument(0);
            store.put(doc.getId(), doc);
            return doc;
        });
        doAnswer(inv -> store.remove(inv.<String>getArgument(0))).when(repo).deleteById(anyString());
        when(repo.findByRepoIdAndActiveTrue(anyString())).thenAnswer(inv -> store.values().stream()
                .filter(d -> d.isActive() && inv.getArgument(0).equals(d.getRepoId()))
                .collect(Collectors.toList()));
        return repo;
    }

    public static DocumentChunkRepository chunks(Map<String, DocumentChunk> store) {
        DocumentChunkRepository repo = lenientMock(DocumentChunkRepository.class);
        when(repo.countByDocumentId(anyString())).thenAnswer(inv -> store.values().stream()
                .filter(c -> c.getDocumentId().equals(inv.getArgument(0)))
                .count());
        when(repo.saveAll(anyIterable())).thenAnswer(inv -> {
            List<DocumentChunk> saved = new ArrayList<>();
            for (DocumentChunk chunk : inv.<Iterable<DocumentChunk>>getArgument(0)) {
                store.put(chunk.getId(), chunk);
                saved.add(chunk);
            }
            return saved;
        });
        when(repo.deleteFromSeq(anyString(), anyInt())).thenAnswer(inv -> {
            String documentId = inv.getArgument(0);
            int fromSeq = inv.getArgument(1);
            List<String> ids = store.values().stream()
                    .filter(c -> c.getDocumentId().equals(documentId) && c.getSeq() >= fromSeq)
                    .map(DocumentChunk::getId)
                    .collect(Collectors.toList());
            ids.forEach(store::remove);
            return ids.size();
        });
        return repo;
    }

    public static SyncJobRepository jobs(Map<String, SyncJob> store) {
        SyncJobRepository repo = lenientMock(SyncJobRepository.class);
        when(repo.save(any(SyncJob.class))).thenAnswer(inv -> {
            SyncJob job = inv.getArgument(0);
            store.put(job.getJobId(), job);
            return job;
        });
        when(repo.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        return repo;
    }

    public static SyncWatermarkRepository watermarks(Map<String, SyncWatermark> store) {
        SyncWatermarkRepository repo = lenientMock(SyncWatermarkRepository.class);
        when(repo.save(any(SyncWatermark.class))).thenAnswer(inv -> {
            SyncWatermark watermark = inv.getArgument(0);
            store.put(watermark.getRepoId(), watermark);
            return watermark;
        });
        when(repo.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        return repo;
    }

    public static ConversationRepository conversations(Map<String, Conversation> store) {
        ConversationRepository repo = lenientMock(ConversationRepository.class);
        when(repo.save(any(Conversation.class))).thenAnswer(inv -> {
            Conversation conversation = inv.getArgument(0);
            store.put(conversation.getChatId(), conversation);
            return conversation;
        });
        when(repo.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        return repo;
    }

    public static ChatMessageRepository messages(Map<Long, ChatMessage> store) {
        AtomicLong ids = new AtomicLong();
        ChatMessageRepository repo = lenientMock(ChatMessageRepository.class);
        when(repo.save(any(ChatMessage.class))).thenAnswer(inv -> {
            ChatMessage message = inv.getArgument(0);
            if (message.getId() == null) {
                message.setId(ids.incrementAndGet());
            }
            store.put(message.getId(), message);
            return message;
        });
        when(repo.findByChatIdOrderByIdDesc(anyString(), any(Pageable.class))).thenAnswer(inv -> {
            String chatId = inv.getArgument(0);
            Pageable pageable = inv.getArgument(1);
            return store.values().stream()
                    .filter(m -> m.getChatId().equals(chatId))
                    .sorted(Comparator.comparing(ChatMessage::getId).reversed())
                    .limit(pageable.getPageSize())
                    .collect(Collectors.toList());
        });
        when(repo.deleteAllByChatId(anyString())).thenAnswer(inv -> {
            String chatId = inv.getArgument(0);
            List<Long> toRemove = store.values().stream()
                    .filter(m -> m.getChatId().equals(chatId))
                    .map(ChatMessage::getId)
                    .collect(Collectors.toList());
            toRemove.forEach(store::remove);
            return toRemove.size();
        });
        return repo;
    }

    public static <K, V> Map<K, V> store() {
        return new LinkedHashMap<>();
    }
}
