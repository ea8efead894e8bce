package com.groceryai.domain.invocation.model;

import java.util.List;

/**
 * A fully built model request. Transports translate it into their wire format.
 *
 * @param config       model id and inference parameters
 * @param systemPrompt optional system prompt (nullable)
 * @param messages     ordered conversation, last message is the user turn
 */
public record InvocationRequest(
        ModelConfig config,
        String systemPrompt,
        List<ChatMessage> messages
) {
    public InvocationRequest {
        messages = List.copyOf(messages);
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
