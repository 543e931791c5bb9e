package fr.lapetina.inference.gateway.domain.model;

import java.util.Objects;

/**
 * One turn of a chat conversation.
 */
public record ChatMessage(String role, String content) {

    public ChatMessage {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
    }
}
