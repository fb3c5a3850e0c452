package com.tripsync.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.config.TripSyncProperties;
import com.tripsync.orchestration.api.AgentException;
import com.tripsync.orchestration.model.FinalSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentChatServiceTest {

    private ChatClient chatClient;
    private ObjectProvider<ChatClient> openAiProvider;
    private TripSyncProperties properties;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        openAiProvider = mock(ObjectProvider.class);
        properties = new TripSyncProperties();
    }

    private AgentChatService service() {
        return new AgentChatService(chatClient, openAiProvider, properties, new JsonProcessingService(new ObjectMapper()));
    }

    @SuppressWarnings("unchecked")
    private void modelAnswers(String first, String... rest) {
        when(chatClient.prompt().system(anyString()).user(any(Consumer.class)).call().content())
                .thenReturn(first, rest);
    }

    @Test
    void testRequestJsonParsesAnswer() {
        modelAnswers("{\"reply\": \"Two flights found\"}");

        FinalSummary summary = service().requestJson("finalize", "system", "{input}", Map.of("input", "x"), FinalSummary.class);

        assertEquals("Two flights found", summary.reply());
    }

    @Test
    void testRequestJsonRetriesOnceWithReminder() {
        modelAnswers("Sure! Here you go", "{\"reply\": \"ok\"}");

        FinalSummary summary = service().requestJson("finalize", "system", "{input}", Map.of("input", "x"), FinalSummary.class);

        assertEquals("ok", summary.reply());
        verify(chatClient.prompt()).system(endsWith("Return only valid JSON."));
    }

    @Test
    void testRequestJsonGivesUpAfterSecondInvalidAnswer() {
        modelAnswers("not json", "still not json");

        AgentException ex = assertThrows(AgentException.class,
                () -> service().requestJson("plan", "system", "{input}", Map.of("input", "x"), FinalSummary.class));

        assertEquals("plan", ex.getPurpose());
    }

    @Test
    void testModelFailureBecomesAgentException() {
        when(chatClient.prompt()).thenThrow(new IllegalStateException("429 Too Many Requests"));

        AgentException ex = assertThrows(AgentException.class,
                () -> service().requestText("intake", "system", "{input}", Map.of("input", "x")));

        assertTrue(ex.getMessage().contains("429"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testOpenAiSelectedWithoutClient() {
        properties.setAiProvider(TripSyncProperties.AiProvider.OPENAI);

        AgentException ex = assertThrows(AgentException.class,
                () -> service().requestText("intake", "system", "{input}", Map.of("input", "x")));

        assertTrue(ex.getMessage().contains("OpenAI"));
    }

    @Test
    void testNullContentIsEmptyText() {
        modelAnswers(null);

        assertEquals("", service().requestText("finalize", "system", "{input}", Map.of("input", "x")));
    }
}
