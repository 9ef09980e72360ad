package com.example.SmartDairy.client;

/**
 * One entry of an ordered completion request.
 */
public record PromptMessage(
        Role role,
        String content
) {

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT
    }

    public static PromptMessage system(String content) {
        return new PromptMessage(Role.SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(Role.USER, content);
    }
}
