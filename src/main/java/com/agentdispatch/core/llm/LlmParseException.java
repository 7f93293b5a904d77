package com.agentdispatch.core.llm;

import com.agentdispatch.core.DispatchException;

/**
 * Thrown when LLM output cannot be parsed into the expected type.
 */
public class LlmParseException extends DispatchException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
