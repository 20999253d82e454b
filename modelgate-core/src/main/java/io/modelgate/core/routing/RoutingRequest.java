package io.modelgate.core.routing;

import io.modelgate.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.List;

public record RoutingRequest(List<ChatMessage> messages, List<String> media, RoutingMode mode, String requestedModel) {

    public RoutingRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        media = media == null ? List.of() : List.copyOf(media);
    }

    /**
     * Builds a request whose media are everything attached to the given messages.
     */
    public static RoutingRequest of(List<ChatMessage> messages) {
        return of(messages, null, null);
    }

    public static RoutingRequest of(List<ChatMessage> messages, RoutingMode mode, String requestedModel) {
        List<String> media = new ArrayList<>();
        if (messages != null) {
            for (ChatMessage message : messages) {
                media.addAll(message.media());
            }
        }
        return new RoutingRequest(messages, media, mode, requestedModel);
    }

    public String joinedContent() {
        return ComplexityScorer.joinedContent(messages);
    }
}
