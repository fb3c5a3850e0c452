package com.tripsync.config;

import com.tripsync.repository.SessionEntryRepository;
import com.tripsync.store.InMemorySessionStore;
import com.tripsync.store.JpaSessionStore;
import com.tripsync.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@Slf4j
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor(TripSyncProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService toolTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean
    public SessionStore sessionStore(TripSyncProperties properties,
                                     ObjectProvider<SessionEntryRepository> repository) {
        if (properties.getStore().getType() == TripSyncProperties.StoreType.MEMORY) {
            log.info("Using in-memory session store; state is lost on restart");
            return new InMemorySessionStore();
        }
        return new JpaSessionStore(repository.getObject());
    }
}
