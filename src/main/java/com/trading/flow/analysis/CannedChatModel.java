package com.trading.flow.analysis;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link ChatModel} that answers without a language model: the reply names
 * the role and the size of the prompt. Every exchange is recorded.
 */
public final class CannedChatModel implements ChatModel {

    public record Exchange(String systemPrompt, String userPrompt, String reply) {
    }

    private final List<Exchange> exchanges = new CopyOnWriteArrayList<>();

    @Override
    public String chat(String systemPrompt, String userPrompt) {
        String reply = "[" + systemPrompt + "] analysed " + userPrompt.length() + " characters of input";
        exchanges.add(new Exchange(systemPrompt, userPrompt, reply));
        return reply;
    }

    public List<Exchange> exchanges() {
        return List.copyOf(exchanges);
    }

    /** The prompt sent with the given role's system message, or null. */
    public String promptFor(AnalystRole role) {
        for (Exchange e : exchanges)
            if (e.systemPrompt().equals(role.systemPrompt()))
                return e.userPrompt();
        return null;
    }
}
