package com.ragguard.model;

import lombok.Value;

/**
 * One conversation turn sent to the generative model
 */
@Value
public class ChatMessage {

    public enum Role { USER, MODEL }

    Role role;
    String text;

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, text);
    }
}
