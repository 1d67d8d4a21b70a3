package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.exception.BackendUnavailableException;
import com.phillippitts.axiom.service.context.ContextSlots;

import java.util.List;
import java.util.Objects;

/**
 * Delegates to a {@link GenerationBackend}. The prompt is the recent history followed by the
 * current user text (read from the {@code last_user_input} slot).
 */
public class BackendResponseStrategy implements ResponseStrategy {

    public static final String NAME = "backend";

    private final GenerationBackend backend;
    private final int historyTurns;

    public BackendResponseStrategy(GenerationBackend backend, int historyTurns) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        if (historyTurns < 0) {
            throw new IllegalArgumentException("historyTurns must be >= 0, got: " + historyTurns);
        }
        this.historyTurns = historyTurns;
    }

    @Override
    public GeneratedResponse respond(Intent intent, SessionContext context) {
        String prompt = buildPrompt(intent, context);
        String text = backend.complete(prompt, context);
        if (text == null || text.isBlank()) {
            throw new BackendUnavailableException(backend.name(), "Backend returned no text");
        }
        return new GeneratedResponse(text.trim(), intent.name(), NAME + ":" + backend.name(), -1);
    }

    String buildPrompt(Intent intent, SessionContext context) {
        StringBuilder prompt = new StringBuilder();
        List<ConversationTurn> history = context.history();
        for (ConversationTurn turn : history.subList(Math.max(0, history.size() - historyTurns), history.size())) {
            prompt.append("User: ").append(turn.userInput()).append('\n')
                    .append("Assistant: ").append(turn.assistantResponse()).append('\n');
        }
        Object input = context.slot(ContextSlots.LAST_USER_INPUT);
        prompt.append("User: ").append(input == null ? "" : input).append('\n')
                .append("(intent: ").append(intent.name()).append(")\n")
                .append("Assistant:");
        return prompt.toString();
    }
}
