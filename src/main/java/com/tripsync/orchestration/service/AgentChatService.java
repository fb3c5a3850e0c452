package com.tripsync.orchestration.service;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.tripsync.config.TripSyncProperties;
import com.tripsync.orchestration.api.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Single entry point for agent model calls: picks the configured provider and retries once
 * when a JSON answer cannot be parsed.
 */
@Service
@Slf4j
public class AgentChatService {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final TripSyncProperties properties;
    private final JsonProcessingService jsonProcessingService;

    public AgentChatService(ChatClient chatClient,
                            @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                            TripSyncProperties properties,
                            JsonProcessingService jsonProcessingService) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
        this.jsonProcessingService = jsonProcessingService;
    }

    public String requestText(String purpose, String systemPrompt, String userTemplate, Map<String, Object> params) {
        log.debug("Requesting {} from {} model", purpose, properties.getAiProvider());
        try {
            String content = getChatRequestSpec()
                    .system(systemPrompt)
                    .user(user -> user.text(userTemplate).params(params))
                    .call()
                    .content();
            return content != null ? content : "";
        } catch (AgentException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new AgentException(purpose, "Model call for " + purpose + " failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Asks for a JSON answer; on an unparseable answer asks once more with a reminder.
     *
     * @throws AgentException when neither answer parses
     */
    public <T> T requestJson(String purpose, String systemPrompt, String userTemplate,
                             Map<String, Object> params, Class<T> type) {
        String response = requestText(purpose, systemPrompt, userTemplate, params);
        T parsed = jsonProcessingService.parseJsonResponse(purpose, response, type);
        if (parsed == null) {
            String retryPurpose = purpose + RETRY_SUFFIX;
            String retryResponse = requestText(retryPurpose, systemPrompt + INVALID_JSON_RETRY_PROMPT, userTemplate, params);
            parsed = jsonProcessingService.parseJsonResponse(retryPurpose, retryResponse, type);
        }
        if (parsed == null) {
            throw new AgentException(purpose, "Model returned no valid JSON for " + purpose);
        }
        return parsed;
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        if (properties.getAiProvider() == TripSyncProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new AgentException("provider", "OpenAI provider selected but no OpenAI chat model is configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getOpenai().getModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        return chatClient.prompt();
    }
}
