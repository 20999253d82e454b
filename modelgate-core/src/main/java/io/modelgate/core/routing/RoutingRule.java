package io.modelgate.core.routing;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.modelgate.core.backend.Tier;
import java.util.List;
import java.util.Locale;

/**
 * Keyword rule mapping a prompt to a tier. Length bounds are optional and inclusive.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutingRule(
    List<String> keywords,
    @JsonAlias({"min_length"}) Integer minLength,
    @JsonAlias({"max_length"}) Integer maxLength,
    @JsonAlias({"level"}) Tier tier,
    int priority
) {

    public RoutingRule {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        tier = tier == null ? Tier.MEDIUM : tier;
    }

    public static RoutingRule of(Tier tier, int priority, String... keywords) {
        return new RoutingRule(List.of(keywords), null, null, tier, priority);
    }

    public boolean accepts(String text, int length) {
        if (minLength != null && length < minLength) {
            return false;
        }
        if (maxLength != null && length > maxLength) {
            return false;
        }
        if (keywords.isEmpty()) {
            return false;
        }
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
    }
}
