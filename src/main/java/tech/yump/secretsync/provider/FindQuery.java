package tech.yump.secretsync.provider;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Bulk-fetch query for {@link SecretsClient#getAllSecrets(FindQuery)}.
 *
 * @param name regular expression matched against the whole secret name
 * @param tags tags every returned secret must carry with equal values
 */
public record FindQuery(@Nullable String name, @Nullable Map<String, String> tags) {

    public FindQuery {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static FindQuery byName(String name) {
        return new FindQuery(name, null);
    }

    public boolean hasNameFilter() {
        return StringUtils.hasText(name);
    }
}
