package com.trading.flow.analysis;

import com.trading.flow.api.Node;
import com.trading.flow.state.StateDelta;
import com.trading.flow.state.StateKey;
import com.trading.flow.state.StateSnapshot;

import java.util.Set;

/**
 * Base for nodes that build a prompt from the state, ask the
 * {@link ChatModel}, and store the reply in a single output field.
 */
public abstract class ChatAnalystNode implements Node {
    private final String name;
    private final AnalystRole role;
    private final ChatModel model;
    private final StateKey<String> output;

    protected ChatAnalystNode(String name, AnalystRole role, ChatModel model, StateKey<String> output) {
        this.name = name;
        this.role = role;
        this.model = model;
        this.output = output;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Set<String> outputs() {
        return Set.of(output.name());
    }

    public AnalystRole role() {
        return role;
    }

    /** Builds the user message from the fields this node reads. */
    protected abstract String prompt(StateSnapshot snapshot);

    @Override
    public StateDelta execute(StateSnapshot snapshot) throws Exception {
        String reply = model.chat(role.systemPrompt(), prompt(snapshot));
        if (reply == null)
            throw new IllegalStateException("Model returned no content for node '" + name + "'");
        return StateDelta.of(output, reply);
    }
}
