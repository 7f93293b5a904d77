package com.agentdispatch.core.llm;

import com.agentdispatch.core.DispatchException;

/**
 * Thrown when the LLM returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends DispatchException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
