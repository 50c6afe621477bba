package org.policybot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.policybot.DTO.MemoryContext;
import org.policybot.DTO.Message;
import org.policybot.client.CompletionModel;
import org.policybot.config.AiProperties;
import org.policybot.config.RagProperties;
import org.policybot.entity.ChatMessage;
import org.policybot.entity.Conversation;
import org.policybot.entity.Language;
import org.policybot.support.InMemoryRepositories;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    private static final String CHAT = "chat-1";

    @Mock
    private CompletionModel completionModel;

    private final Map<String, Conversation> conversations = InMemoryRepositories.store();
    private final Map<Long, ChatMessage> messages = InMemoryRepositories.store();
    private final AiProperties aiProperties = new AiProperties();
    private RagProperties ragProperties;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        ragProperties = new RagProperties();
        ragProperties.setSummaryTriggerMessages(4);
        ragProperties.setSummaryTriggerChars(200);
        service = new ConversationService(InMemoryRepositories.conversations(conversations),
                InMemoryRepositories.messages(messages), completionModel, ragProperties, aiProperties);
    }

    @Test
    void createsConversationWithDefaultLanguage() {
        Conversation conversation = service.getOrCreate(CHAT, Language.EN);

        assertThat(conversation.getLang()).isEqualTo(Language.EN);
        assertThat(service.getOrCreate(CHAT, Language.KO).getLang()).isEqualTo(Language.EN);
        assertThat(service.getOrCreate("chat-2", null).getLang()).isEqualTo(Language.KO);
    }

    @Test
    void summaryTriggersAfterMessageCount() {
        when(completionModel.complete(anyList(), any())).thenReturn("user asks about annual leave");

        for (int i = 0; i < 3; i++) {
            service.appendMessage(CHAT, ChatMessage.Role.USER, "q" + i, null, null);
        }
        verifyNoInteractions(completionModel);

        service.appendMessage(CHAT, ChatMessage.Role.ASSISTANT, "a", null, 0.9);

        Conversation conversation = conversations.get(CHAT);
        assertThat(conversation.getSummary()).isEqualTo("user asks about annual leave");
        assertThat(conversation.getMessagesSinceSummary()).isZero();
        assertThat(conversation.getMessageCount()).isEqualTo(4);
        assertThat(conversation.getSummaryUpdatedAt()).isNotNull();
    }

    @Test
    void summaryTriggersOnLongMessages() {
        when(completionModel.complete(anyList(), any())).thenReturn("long question about travel");

        service.appendMessage(CHAT, ChatMessage.Role.USER, "x".repeat(250), null, null);

        assertThat(conversations.get(CHAT).getSummary()).isEqualTo("long question about travel");
        verify(completionModel).complete(anyList(), same(aiProperties.getSummary()));
    }

    @Test
    void charTriggerOnlyCountsMessagesSinceLastSummary() {
        when(completionModel.complete(anyList(), any())).thenReturn("summary");
        service.appendMessage(CHAT, ChatMessage.Role.USER, "x".repeat(250), null, null);
        clearInvocations(completionModel);

        service.appendMessage(CHAT, ChatMessage.Role.ASSISTANT, "short", null, null);

        verifyNoInteractions(completionModel);
        assertThat(conversations.get(CHAT).getMessagesSinceSummary()).isEqualTo(1);
    }

    @Test
    void blankSummaryFromModelKeepsPreviousSummary() {
        Conversation conversation = service.getOrCreate(CHAT, Language.KO);
        conversation.setSummary("previous summary");
        when(completionModel.complete(anyList(), any())).thenReturn("  ");

        for (int i = 0; i < 4; i++) {
            service.appendMessage(CHAT, ChatMessage.Role.USER, "q" + i, null, null);
        }

        assertThat(conversations.get(CHAT).getSummary()).isEqualTo("previous summary");
    }

    @Test
    void summaryFailureKeepsPreviousSummary() {
        Conversation conversation = service.getOrCreate(CHAT, Language.KO);
        conversation.setSummary("previous summary");
        when(completionModel.complete(anyList(), any())).thenThrow(new IllegalStateException("model down"));

        for (int i = 0; i < 4; i++) {
            service.appendMessage(CHAT, ChatMessage.Role.USER, "q" + i, null, null);
        }

        assertThat(conversations.get(CHAT).getSummary()).isEqualTo("previous summary");
        assertThat(conversations.get(CHAT).getMessagesSinceSummary()).isEqualTo(4);
        assertThat(messages).hasSize(4);
    }

    @Test
    void contextKeepsNewestMessagesWithinBudget() {
        service.getOrCreate(CHAT, Language.EN);
        append("1111", "2222", "3333", "4444", "5555");

        MemoryContext context = service.buildContext(CHAT, 3);

        assertThat(context.getRecentMessages()).extracting(Message::getContent)
                .containsExactly("3333", "4444", "5555");
        assertThat(context.getTotalTokens()).isEqualTo(3);
    }

    @Test
    void summaryIsCountedBeforeMessages() {
        Conversation conversation = service.getOrCreate(CHAT, Language.EN);
        conversation.setSummary("12345678");
        append("1111", "2222", "3333");

        MemoryContext context = service.buildContext(CHAT, 3);

        assertThat(context.getSummary()).isEqualTo("12345678");
        assertThat(context.getRecentMessages()).extracting(Message::getContent).containsExactly("3333");
        assertThat(context.getTotalTokens()).isEqualTo(3);
    }

    @Test
    void oversizedSummaryIsTruncatedToBudget() {
        Conversation conversation = service.getOrCreate(CHAT, Language.EN);
        conversation.setSummary("s".repeat(100));
        append("1111");

        MemoryContext context = service.buildContext(CHAT, 5);

        assertThat(context.getSummary()).hasSize(20);
        assertThat(context.getRecentMessages()).isEmpty();
        assertThat(context.getTotalTokens()).isEqualTo(5);
    }

    @Test
    void firstMessageThatDoesNotFitStopsSelection() {
        service.getOrCreate(CHAT, Language.EN);
        append("1111", "x".repeat(40), "2222");

        MemoryContext context = service.buildContext(CHAT, 5);

        // 中间的长消息放不下，更早的短消息也不再加入
        assertThat(context.getRecentMessages()).extracting(Message::getContent).containsExactly("2222");
    }

    @Test
    void largerBudgetNeverKeepsFewerMessages() {
        service.getOrCreate(CHAT, Language.EN);
        append("aaaa", "bbbbbbbb", "cc", "dddddddddddd", "e");

        int previous = -1;
        for (int budget = 0; budget <= 12; budget++) {
            int size = service.buildContext(CHAT, budget).getRecentMessages().size();
            assertThat(size).isGreaterThanOrEqualTo(Math.max(previous, 0));
            assertThat(service.buildContext(CHAT, budget).getTotalTokens()).isLessThanOrEqualTo(budget);
            previous = size;
        }
    }

    @Test
    void unknownConversationHasEmptyContext() {
        MemoryContext context = service.buildContext("missing", 100);

        assertThat(context.getRecentMessages()).isEmpty();
        assertThat(context.getSummary()).isNull();
    }

    @Test
    void resetClearsMessagesAndSummaryButKeepsConversation() {
        Conversation conversation = service.getOrCreate(CHAT, Language.EN);
        conversation.setSummary("old");
        append("1111", "2222");

        service.reset(CHAT);

        assertThat(conversations).containsKey(CHAT);
        assertThat(conversations.get(CHAT).getSummary()).isNull();
        assertThat(conversations.get(CHAT).getMessageCount()).isZero();
        assertThat(conversations.get(CHAT).getLang()).isEqualTo(Language.EN);
        assertThat(messages).isEmpty();
        assertThat(service.buildContext(CHAT, 100).getRecentMessages()).isEmpty();
    }

    @Test
    void statsReportsCounts() {
        service.getOrCreate(CHAT, Language.EN);
        append("1111", "2222");

        Map<String, Object> stats = service.stats(CHAT);

        assertThat(stats).containsEntry("messageCount", 2).containsEntry("hasSummary", false)
                .containsEntry("lang", "en");
    }

    /**
     * 只写消息，不触发摘要
     */
    private void append(String... texts) {
        ragProperties.setSummaryTriggerMessages(1000);
        ragProperties.setSummaryTriggerChars(100_000);
        ChatMessage.Role role = ChatMessage.Role.USER;
        for (String text : texts) {
            service.appendMessage(CHAT, role, text, null, null);
            role = role == ChatMessage.Role.USER ? ChatMessage.Role.ASSISTANT : ChatMessage.Role.USER;
        }
    }
}
