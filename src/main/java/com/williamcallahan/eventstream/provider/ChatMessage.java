package com.williamcallahan.eventstream.provider;

import java.util.Locale;
import java.util.Set;

/**
 * One conversation turn sent to a provider.
 *
 * @param role {@code system}, {@code developer}, {@code user} or {@code assistant}
 * @param content message text
 */
public record ChatMessage(String role, String content) {

    private static final Set<String> ROLES = Set.of("system", "developer", "user", "assistant");

    public ChatMessage {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        role = role.trim().toLowerCase(Locale.ROOT);
        if (!ROLES.contains(role)) {
            throw new IllegalArgumentException("unsupported message role: " + role);
        }
        content = content == null ? "" : content;
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
