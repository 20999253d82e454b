package io.modelgate.core.routing;

public record RouterStatus(
    boolean auto,
    boolean performanceFirst,
    int rulesCount,
    int candidateCount,
    String chatModel,
    String intentModel
) {
}
