package io.modelgate.core.routing;

public record TaskTypeResult(TaskType type, String reason) {
}
