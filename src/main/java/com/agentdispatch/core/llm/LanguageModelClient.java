package com.agentdispatch.core.llm;

/**
 * Structured-output access to a language model.
 * <p>
 * The only non-deterministic collaborator of the engine. Implementations may throw any
 * runtime exception; callers degrade to their deterministic path.
 */
public interface LanguageModelClient {

    /**
     * Sends a system + user prompt and deserializes the reply into {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returned no content
     * @throws LlmParseException         if the content does not fit {@code outputType}
     */
    <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType);
}
