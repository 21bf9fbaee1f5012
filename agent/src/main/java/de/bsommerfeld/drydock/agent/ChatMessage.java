package de.bsommerfeld.drydock.agent;

import java.util.Objects;

/**
 * One turn of an assistant conversation.
 */
public record ChatMessage(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }
}
