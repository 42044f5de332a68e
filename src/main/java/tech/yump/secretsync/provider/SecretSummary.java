package tech.yump.secretsync.provider;

import java.util.Map;

/**
 * A listed secret: its name and the tags the backend reports for it.
 */
public record SecretSummary(String name, Map<String, String> tags) {

    public SecretSummary {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static SecretSummary named(String name) {
        return new SecretSummary(name, Map.of());
    }

    boolean hasTags(Map<String, String> required) {
        return tags.entrySet().containsAll(required.entrySet());
    }
}
