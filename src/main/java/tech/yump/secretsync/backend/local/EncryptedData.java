package tech.yump.secretsync.backend.local;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Base64;

/**
 * One encrypted secret version as stored on disk:
 *
 * <pre>
 * {"v": 1, "n": "&lt;base64 nonce&gt;", "c": "&lt;base64 ciphertext+tag&gt;", "ts": "2024-05-01T12:00:00Z"}
 * </pre>
 *
 * @param formatVersion layout version of this document
 * @param writtenAt     when the version was written
 */
public record EncryptedData(
        @JsonProperty("v") int formatVersion,
        @JsonProperty("n") String nonce,
        @JsonProperty("c") String ciphertext,
        @JsonProperty("ts") Instant writtenAt
) {

    public static final int FORMAT_VERSION = 1;

    public static EncryptedData of(EncryptionService.Sealed sealed, Instant writtenAt) {
        Base64.Encoder encoder = Base64.getEncoder();
        return new EncryptedData(FORMAT_VERSION, encoder.encodeToString(sealed.nonce()),
                encoder.encodeToString(sealed.ciphertext()), writtenAt);
    }

    /**
     * @throws IllegalStateException if the document has an unknown format or lacks nonce or ciphertext
     * @throws IllegalArgumentException if nonce or ciphertext are not Base64
     */
    public EncryptionService.Sealed toSealed() {
        if (formatVersion != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported encrypted data format version " + formatVersion);
        }
        if (nonce == null || ciphertext == null) {
            throw new IllegalStateException("Encrypted data lacks nonce or ciphertext");
        }
        Base64.Decoder decoder = Base64.getDecoder();
        return new EncryptionService.Sealed(decoder.decode(nonce), decoder.decode(ciphertext));
    }
}
