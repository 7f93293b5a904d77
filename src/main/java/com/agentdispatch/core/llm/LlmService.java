package com.agentdispatch.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;

/**
 * {@link LanguageModelClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target
 * Java class, append format instructions to the user prompt, and deserialize
 * the LLM's JSON response into the requested type. Falls back to a lenient
 * Jackson parse when the converter rejects the reply.
 * <p>
 * Registered as a bean only when {@code dispatcher.llm.enabled=true}.
 */
public class LlmService implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final ObjectMapper LENIENT = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseLenient(response, outputType);
        }
    }

    /**
     * Lenient Jackson parse that tolerates markdown fences and unknown properties.
     */
    static <T> T parseLenient(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        try {
            return LENIENT.readValue(cleaned, outputType);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }
}
