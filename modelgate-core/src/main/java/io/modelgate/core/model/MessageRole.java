package io.modelgate.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
