package org.policybot.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.policybot.DTO.AnswerResult;
import org.policybot.DTO.ChatReply;
import org.policybot.DTO.MemoryContext;
import org.policybot.DTO.RequestContext;
import org.policybot.DTO.RetrievalResult;
import org.policybot.DTO.ScoredChunk;
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

import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatHandlerTest {

    private static final String CHAT = "100";

    @Mock
    private ConversationService conversationService;
    @Mock
    private RetrievalService retrievalService;
    @Mock
    private AnswerService answerService;
    @Mock
    private SessionLockService sessionLockService;

    private ChatHandler chatHandler;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        chatHandler = new ChatHandler(conversationService, retrievalService, answerService, sessionLockService,
                new AiProperties(), new SyncProperties(), new ObjectMapper());
        conversation = new Conversation();
        conversation.setChatId(CHAT);
        conversation.setLang(Language.KO);

        lenient().when(sessionLockService.withLock(eq(CHAT), any()))
                .thenAnswer(inv -> inv.<Supplier<?>>getArgument(1).get());
        lenient().when(conversationService.getOrCreate(eq(CHAT), any())).thenReturn(conversation);
        lenient().when(conversationService.buildContext(CHAT)).thenReturn(MemoryContext.empty());
    }

    @Test
    void insufficientEvidenceReturnsFixedTextWithoutCallingModel() {
        when(retrievalService.retrieve(anyString(), eq(Language.KO)))
                .thenReturn(RetrievalResult.insufficient(0.75, Language.KO));

        ChatReply reply = chatHandler.handle(RequestContext.of(CHAT, "api"), "식대 규정이 있나요?", null);

        assertThat(reply.isHasEvidence()).isFalse();
        assertThat(reply.getAnswer()).isEqualTo(new AiProperties().noEvidenceText(Language.KO));
        assertThat(reply.getSources()).isEmpty();
        verifyNoInteractions(answerService);
        verify(conversationService).appendMessage(eq(CHAT), eq(ChatMessage.Role.ASSISTANT),
                eq(reply.getAnswer()), isNull(), eq(0.75));
    }

    @Test
    void userMessageIsStoredBeforeRetrievalAndMemoryBuiltBeforeThat() {
        when(retrievalService.retrieve(anyString(), any()))
                .thenReturn(RetrievalResult.insufficient(0.1, Language.KO));

        chatHandler.handle(RequestContext.of(CHAT, "api"), "연차는 며칠인가요?", null);

        InOrder order = inOrder(conversationService, retrievalService);
        order.verify(conversationService).buildContext(CHAT);
        order.verify(conversationService).appendMessage(CHAT, ChatMessage.Role.USER, "연차는 며칠인가요?", null, null);
        order.verify(retrievalService).retrieve("연차는 며칠인가요?", Language.KO);
        order.verify(conversationService).appendMessage(eq(CHAT), eq(ChatMessage.Role.ASSISTANT), anyString(), isNull(), eq(0.1));
    }

    @Test
    void sufficientEvidenceProducesAnswerWithSources() {
        ScoredChunk chunk = new ScoredChunk("d_0", "d", "policies/leave.md", "휴가 규정", "연차 15일",
                "https://github.com/acme/policies/blob/r/policies/leave.md", "ko", 0, 0.9);
        RetrievalResult retrieval = new RetrievalResult(List.of(chunk), 0.9, true, Language.KO);
        List<SourceRef> sources = List.of(new SourceRef("휴가 규정", chunk.getUrl(), chunk.getFilePath(), 0.9));
        when(retrievalService.retrieve(anyString(), eq(Language.KO))).thenReturn(retrieval);
        when(answerService.answer(anyString(), eq(retrieval), any(MemoryContext.class), eq(Language.KO)))
                .thenReturn(new AnswerResult("연차는 15일입니다.", sources));

        ChatReply reply = chatHandler.handle(RequestContext.of(CHAT, "api"), "연차는 며칠인가요?", null);

        assertThat(reply.isHasEvidence()).isTrue();
        assertThat(reply.getSources()).hasSize(1);
        assertThat(reply.getLang()).isEqualTo("ko");
        verify(conversationService).appendMessage(eq(CHAT), eq(ChatMessage.Role.ASSISTANT), eq("연차는 15일입니다."),
                contains("휴가 규정"), eq(0.9));
    }

    @Test
    void detectedLanguageChangeUpdatesConversation() {
        when(retrievalService.retrieve(anyString(), eq(Language.EN)))
                .thenReturn(RetrievalResult.insufficient(0.2, Language.EN));

        ChatReply reply = chatHandler.handle(RequestContext.of(CHAT, "api"), "How many leave days do I get?", null);

        assertThat(reply.getLang()).isEqualTo("en");
        verify(conversationService).setLanguage(CHAT, Language.EN);
    }

    @Test
    void explicitLanguageWins() {
        conversation.setLang(Language.EN);
        when(retrievalService.retrieve(anyString(), eq(Language.EN)))
                .thenReturn(RetrievalResult.insufficient(0.2, Language.EN));

        ChatReply reply = chatHandler.handle(RequestContext.of(CHAT, "api"), "연차는 며칠인가요?", Language.EN);

        assertThat(reply.getAnswer()).isEqualTo(new AiProperties().noEvidenceText(Language.EN));
        verify(conversationService, never()).setLanguage(anyString(), any());
    }

    @Test
    void wholeTurnRunsUnderSessionLock() {
        when(retrievalService.retrieve(anyString(), any()))
                .thenReturn(RetrievalResult.insufficient(0.2, Language.KO));

        chatHandler.handle(RequestContext.of(CHAT, "api"), "질문", null);

        verify(sessionLockService).withLock(eq(CHAT), any());
    }
}
