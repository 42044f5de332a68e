package tech.yump.secretsync.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secretsync.provider.error.MalformedPayloadException;
import tech.yump.secretsync.provider.error.PropertyNotFoundException;
import tech.yump.secretsync.provider.error.SourceKeyNotFoundException;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataExtractorTest {

    private DataExtractor dataExtractor;

    @BeforeEach
    void setUp() {
        dataExtractor = new DataExtractor(new ObjectMapper());
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("flatten: Strings stay raw, other leaves become compact JSON")
    void flatten_mixedLeaves() {
        Map<String, byte[]> result = dataExtractor.flatten("s",
                utf8("{\"a\":\"x\",\"b\":42,\"c\":true,\"d\":null,\"e\":{\"f\":1},\"g\":[1,2]}"));

        assertThat(result).hasSize(6);
        assertThat(str(result.get("a"))).isEqualTo("x");
        assertThat(str(result.get("b"))).isEqualTo("42");
        assertThat(str(result.get("c"))).isEqualTo("true");
        assertThat(str(result.get("d"))).isEqualTo("null");
        assertThat(str(result.get("e"))).isEqualTo("{\"f\":1}");
        assertThat(str(result.get("g"))).isEqualTo("[1,2]");
    }

    @Test
    @DisplayName("flatten: Should fail with MALFORMED_PAYLOAD for non-object payloads")
    void flatten_nonObject_throws() {
        assertThatThrownBy(() -> dataExtractor.flatten("s", utf8("[1,2]")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("not a JSON object");
        assertThatThrownBy(() -> dataExtractor.flatten("s", utf8("plain text")))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("Failed to parse secret 's'");
    }

    @Test
    @DisplayName("extractProperty: Should return the stringified field or fail when missing")
    void extractProperty() {
        byte[] payload = utf8("{\"user\":\"admin\",\"port\":5432}");

        assertThat(str(dataExtractor.extractProperty("db", payload, "user"))).isEqualTo("admin");
        assertThat(str(dataExtractor.extractProperty("db", payload, "port"))).isEqualTo("5432");
        assertThatThrownBy(() -> dataExtractor.extractProperty("db", payload, "password"))
                .isInstanceOf(PropertyNotFoundException.class)
                .hasMessage("Property 'password' not found in secret 'db'");
    }

    @Test
    @DisplayName("resolvePushValue: Should pick the source key, or the whole map as sorted JSON")
    void resolvePushValue() {
        Map<String, byte[]> source = new LinkedHashMap<>();
        source.put("z", utf8("last"));
        source.put("a", utf8("first"));

        byte[] single = dataExtractor.resolvePushValue(new PushSpec("a", "remote", null), source);
        byte[] whole = dataExtractor.resolvePushValue(new PushSpec(null, "remote", null), source);

        assertThat(str(single)).isEqualTo("first");
        assertThat(str(whole)).isEqualTo("{\"a\":\"first\",\"z\":\"last\"}");
    }

    @Test
    @DisplayName("resolvePushValue: Should fail with SOURCE_KEY_NOT_FOUND for an absent key")
    void resolvePushValue_missingKey_throws() {
        assertThatThrownBy(() -> dataExtractor.resolvePushValue(new PushSpec("missing", "remote", null), Map.of()))
                .isInstanceOf(SourceKeyNotFoundException.class)
                .hasMessageContaining("'missing'");
    }

    @Test
    @DisplayName("mergeProperty: Should keep other fields and start from an empty object")
    void mergeProperty() {
        byte[] merged = dataExtractor.mergeProperty("s", utf8("{\"keep\":\"me\",\"p\":\"old\"}"), "p", utf8("new"));
        byte[] fresh = dataExtractor.mergeProperty("s", null, "p", utf8("v"));

        Map<String, byte[]> flat = dataExtractor.flatten("s", merged);
        assertThat(str(flat.get("keep"))).isEqualTo("me");
        assertThat(str(flat.get("p"))).isEqualTo("new");
        assertThat(str(fresh)).isEqualTo("{\"p\":\"v\"}");
    }
}
