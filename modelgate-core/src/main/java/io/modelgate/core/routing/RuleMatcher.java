package io.modelgate.core.routing;

import io.modelgate.core.backend.Tier;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * First-match keyword rules, evaluated highest priority first. Rules with equal priority keep
 * their configured order.
 */
public final class RuleMatcher {
    private final boolean enabled;
    private final List<RoutingRule> rules;

    public RuleMatcher(RoutingConfig config) {
        this.enabled = config.enabled();
        this.rules = config.rules().stream()
            .sorted(Comparator.comparingInt(RoutingRule::priority).reversed())
            .toList();
    }

    public Optional<Tier> match(String text, int length) {
        return matchRule(text, length).map(RoutingRule::tier);
    }

    public Optional<RoutingRule> matchRule(String text, int length) {
        if (!enabled) {
            return Optional.empty();
        }
        for (RoutingRule rule : rules) {
            if (rule.accepts(text, length)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public int ruleCount() {
        return rules.size();
    }
}
