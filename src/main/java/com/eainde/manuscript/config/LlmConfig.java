package com.eainde.manuscript.config;

import com.eainde.manuscript.collaborator.ClaimListDrafter;
import com.eainde.manuscript.collaborator.DelimitedTripleExtractor;
import com.eainde.manuscript.collaborator.Drafter;
import com.eainde.manuscript.collaborator.Extractor;
import com.eainde.manuscript.collaborator.SuggestionTextRewriter;
import com.eainde.manuscript.collaborator.TextRewriter;
import com.eainde.manuscript.governance.tone.ToneLinter;
import com.eainde.manuscript.llm.ChatModelDrafter;
import com.eainde.manuscript.llm.ChatModelExtractor;
import com.eainde.manuscript.llm.ChatModelTextRewriter;
import com.eainde.manuscript.prompts.ClasspathPromptSource;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.prompts.PromptTemplate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Model-backed collaborators.
 * <p>
 * With {@code manuscript.llm.base-url} set, the extractor, drafter and tone rewriter talk to an
 * OpenAI-compatible endpoint. Without it the pipeline runs on the deterministic local collaborators.
 * </p>
 */
@Log4j2
@Configuration
public class LlmConfig {

    @Value("${manuscript.prompts.cache-ttl:PT5M}")
    private String promptCacheTtl;

    @Value("${manuscript.prompts.cache-max-size:256}")
    private long promptCacheMaxSize;

    @Bean
    public Cache<String, PromptTemplate> promptCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(Duration.parse(promptCacheTtl))
                .maximumSize(promptCacheMaxSize)
                .ticker(Ticker.systemTicker())
                .build();
    }

    @Bean
    public PromptRegistry promptRegistry(Cache<String, PromptTemplate> promptCache) {
        return new PromptRegistry(new ClasspathPromptSource("prompts"), promptCache);
    }

    @Bean
    @ConditionalOnProperty(name = "manuscript.llm.base-url")
    public ChatModel chatModel(@Value("${manuscript.llm.base-url}") String baseUrl,
                               @Value("${manuscript.llm.api-key:}") String apiKey,
                               @Value("${manuscript.llm.model:gpt-4o-mini}") String model,
                               @Value("${manuscript.llm.temperature:0.0}") double temperature,
                               @Value("${manuscript.llm.timeout:PT60S}") String timeout,
                               @Value("${manuscript.llm.max-retries:2}") int maxRetries) {
        log.info("Using chat model {} at {}", model, baseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(model)
                .temperature(temperature)
                .timeout(Duration.parse(timeout))
                .maxRetries(maxRetries)
                .build();
    }

    @Bean
    public Extractor extractor(ObjectProvider<ChatModel> chatModel, PromptRegistry prompts, ObjectMapper objectMapper) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No chat model configured, extracting with the delimited-line extractor");
            return new DelimitedTripleExtractor();
        }
        return new ChatModelExtractor(model, prompts, objectMapper);
    }

    @Bean
    public Drafter drafter(ObjectProvider<ChatModel> chatModel, PromptRegistry prompts) {
        ChatModel model = chatModel.getIfAvailable();
        return model == null ? new ClaimListDrafter() : new ChatModelDrafter(model, prompts);
    }

    @Bean
    public TextRewriter textRewriter(ObjectProvider<ChatModel> chatModel, PromptRegistry prompts, ToneLinter toneLinter) {
        ChatModel model = chatModel.getIfAvailable();
        return model == null ? new SuggestionTextRewriter(toneLinter) : new ChatModelTextRewriter(model, prompts);
    }
}
