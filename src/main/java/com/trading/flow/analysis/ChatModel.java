package com.trading.flow.analysis;

import java.io.IOException;

/**
 * A chat-completion language model.
 */
public interface ChatModel {

    /**
     * Sends one system message and one user message, returns the reply text.
     *
     * @throws IOException if the model cannot be reached.
     */
    String chat(String systemPrompt, String userPrompt) throws IOException;
}
