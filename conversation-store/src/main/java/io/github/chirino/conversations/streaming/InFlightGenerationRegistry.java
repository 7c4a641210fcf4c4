package io.github.chirino.conversations.streaming;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** At most one open generation per conversation. */
public final class InFlightGenerationRegistry {
    private final Map<String, InFlightGeneration> entries = new ConcurrentHashMap<>();

    /**
     * Registers {@code generation} unless another open generation exists for the same
     * conversation.
     *
     * @return false when the conversation already has an open generation
     */
    boolean register(InFlightGeneration generation) {
        InFlightGeneration result =
                entries.compute(
                        generation.conversationId(),
                        (id, previous) ->
                                previous == null || previous.isClosed() ? generation : previous);
        return result == generation;
    }

    InFlightGeneration get(String conversationId) {
        return entries.get(conversationId);
    }

    void remove(InFlightGeneration generation) {
        entries.remove(generation.conversationId(), generation);
    }

    List<InFlightGeneration> snapshot() {
        return List.copyOf(entries.values());
    }
}
