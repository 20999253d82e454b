package io.modelgate.core.routing;

import java.util.List;
import java.util.Locale;

public final class ToolNeedDetector {
    private final List<String> keywords;

    public ToolNeedDetector(List<String> keywords) {
        this.keywords = keywords == null
            ? List.of()
            : keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
    }

    public boolean needsTools(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
