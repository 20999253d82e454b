package io.modelgate.core.routing;

import io.modelgate.core.backend.Tier;
import io.modelgate.core.model.ChatMessage;
import java.util.List;

/**
 * Maps a conversation to a 0-100 complexity score using the coefficients in {@link RoutingConfig}.
 */
public final class ComplexityScorer {
    private static final int MAX_LENGTH_BONUS = 20;
    private static final int MAX_TURN_BONUS = 10;

    private final RoutingConfig config;
    private final ToolNeedDetector toolNeedDetector;

    public ComplexityScorer(RoutingConfig config) {
        this.config = config;
        this.toolNeedDetector = new ToolNeedDetector(config.toolKeywords());
    }

    public int score(List<ChatMessage> messages, String rawText, int length) {
        String text = rawText == null ? "" : rawText;
        long score = config.baseScore();

        score += Math.min(MAX_LENGTH_BONUS, (long) Math.max(0, length / 100) * config.lengthWeight());

        if (text.contains("`")) {
            score += config.codeBlockScore();
        }
        if (toolNeedDetector.needsTools(text)) {
            score += config.toolCallScore();
        }

        int turns = messages == null ? 0 : messages.size();
        if (turns > 1) {
            score += Math.min(MAX_TURN_BONUS, (long) turns * config.multiTurnScore());
        }

        return (int) Math.max(0, Math.min(100, score));
    }

    public int score(List<ChatMessage> messages) {
        String text = joinedContent(messages);
        return score(messages, text, text.length());
    }

    public Tier tierFor(int score) {
        return Tier.fromScore(score);
    }

    static String joinedContent(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "";
        }
        return String.join(" ", messages.stream().map(ChatMessage::content).toList());
    }
}
