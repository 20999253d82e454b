package io.modelgate.core.routing;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.modelgate.core.backend.Tier;
import java.util.List;

/**
 * Scorer coefficients and keyword rules. Everything here is operator-tunable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(
    boolean enabled,
    @JsonAlias({"base_score"}) int baseScore,
    @JsonAlias({"length_weight"}) int lengthWeight,
    @JsonAlias({"code_block_score"}) int codeBlockScore,
    @JsonAlias({"tool_call_score"}) int toolCallScore,
    @JsonAlias({"multi_turn_score"}) int multiTurnScore,
    List<RoutingRule> rules,
    @JsonAlias({"tool_keywords"}) List<String> toolKeywords
) {

    public RoutingConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
        toolKeywords = toolKeywords == null ? List.of() : List.copyOf(toolKeywords);
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig(true, 30, 5, 10, 15, 2, defaultRules(), defaultToolKeywords());
    }

    public RoutingConfig withBaseScore(int score) {
        return new RoutingConfig(enabled, score, lengthWeight, codeBlockScore, toolCallScore, multiTurnScore, rules, toolKeywords);
    }

    public RoutingConfig withRules(List<RoutingRule> replacement) {
        return new RoutingConfig(enabled, baseScore, lengthWeight, codeBlockScore, toolCallScore, multiTurnScore, replacement, toolKeywords);
    }

    public static List<RoutingRule> defaultRules() {
        return List.of(
            RoutingRule.of(Tier.ULTRA, 10, "architecture", "refactor", "design pattern"),
            new RoutingRule(List.of("optimize", "performance"), 500, null, Tier.ULTRA, 9),
            RoutingRule.of(Tier.HIGH, 8, "implement", "create", "develop"),
            new RoutingRule(List.of("analyze", "parse"), 300, null, Tier.HIGH, 7),
            RoutingRule.of(Tier.HIGH, 7, "debug", "fix", "bug"),
            RoutingRule.of(Tier.MEDIUM, 5, "explain", "describe"),
            RoutingRule.of(Tier.MEDIUM, 5, "modify", "update"),
            RoutingRule.of(Tier.MEDIUM, 5, "compare", "contrast"),
            RoutingRule.of(Tier.LOW, 3, "translate", "format"),
            new RoutingRule(List.of("summarize", "summary"), null, 1000, Tier.LOW, 3),
            RoutingRule.of(Tier.FAST, 2, "hello", "hey there", "good morning"),
            RoutingRule.of(Tier.FAST, 2, "thanks", "thank you"),
            RoutingRule.of(Tier.FAST, 2, "bye", "goodbye")
        );
    }

    public static List<String> defaultToolKeywords() {
        return List.of(
            "tool", "cpu", "memory usage", "disk", "process list", "file", "directory",
            "command", "script", "shell", "bash", "execute", "download", "upload", "search the web"
        );
    }
}
