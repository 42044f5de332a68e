package tech.yump.secretsync.backend.local;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.AEADBadTagException;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EncryptionServiceTest {

    private static final String CONTEXT = "db/versions/1";

    private SecretKey masterKey;
    private EncryptionService encryptionService;
    private byte[] plaintext;

    private static SecretKey randomKey() {
        byte[] keyBytes = new byte[EncryptionService.KEY_LENGTH_BYTE];
        new SecureRandom().nextBytes(keyBytes);
        return new SecretKeySpec(keyBytes, "AES");
    }

    @BeforeEach
    void setUp() {
        masterKey = randomKey();
        encryptionService = new EncryptionService(masterKey);
        plaintext = "{\"password\":\"s3cr3t\"}".getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("seal then open under the same context should return the plaintext")
    void sealOpen_SameContext_Success() {
        EncryptionService.Sealed sealed = encryptionService.seal(plaintext, CONTEXT);

        assertEquals(EncryptionService.NONCE_LENGTH_BYTE, sealed.nonce().length);
        assertEquals(plaintext.length + EncryptionService.TAG_LENGTH_BYTE, sealed.ciphertext().length);
        assertArrayEquals(plaintext, encryptionService.open(sealed, CONTEXT));
    }

    @Test
    @DisplayName("Sealing the same value twice should use fresh nonces")
    void seal_FreshNonce() {
        EncryptionService.Sealed first = encryptionService.seal(plaintext, CONTEXT);
        EncryptionService.Sealed second = encryptionService.seal(plaintext, CONTEXT);

        assertFalse(Arrays.equals(first.nonce(), second.nonce()));
    }

    @Test
    @DisplayName("open under another context should fail authentication")
    void open_OtherContext_Throws() {
        EncryptionService.Sealed sealed = encryptionService.seal(plaintext, CONTEXT);

        EncryptionService.EncryptionException exception = assertThrows(EncryptionService.EncryptionException.class,
                () -> encryptionService.open(sealed, "db/versions/2"));
        assertInstanceOf(AEADBadTagException.class, exception.getCause());
    }

    @Test
    @DisplayName("open with another master key should fail authentication")
    void open_OtherKey_Throws() {
        EncryptionService.Sealed sealed = encryptionService.seal(plaintext, CONTEXT);
        EncryptionService other = new EncryptionService(randomKey());

        EncryptionService.EncryptionException exception =
                assertThrows(EncryptionService.EncryptionException.class, () -> other.open(sealed, CONTEXT));
        assertInstanceOf(AEADBadTagException.class, exception.getCause());
    }

    @Test
    @DisplayName("open should reject a truncated nonce or ciphertext")
    void open_Truncated_Throws() {
        EncryptionService.Sealed sealed = encryptionService.seal(plaintext, CONTEXT);

        EncryptionService.EncryptionException badNonce = assertThrows(EncryptionService.EncryptionException.class,
                () -> encryptionService.open(new EncryptionService.Sealed(new byte[4], sealed.ciphertext()), CONTEXT));
        EncryptionService.EncryptionException badCiphertext = assertThrows(EncryptionService.EncryptionException.class,
                () -> encryptionService.open(new EncryptionService.Sealed(sealed.nonce(), new byte[3]), CONTEXT));

        assertTrue(badNonce.getMessage().contains("nonce"));
        assertTrue(badCiphertext.getMessage().contains("authentication tag"));
    }

    @Test
    @DisplayName("keyFromBase64 should accept 32-byte keys only")
    void keyFromBase64_Length() {
        String valid = Base64.getEncoder().encodeToString(masterKey.getEncoded());
        String tooShort = Base64.getEncoder().encodeToString(new byte[16]);

        assertArrayEquals(masterKey.getEncoded(), EncryptionService.keyFromBase64(valid).getEncoded());
        assertThrows(IllegalArgumentException.class, () -> EncryptionService.keyFromBase64(tooShort));
        assertThrows(IllegalArgumentException.class, () -> EncryptionService.keyFromBase64("not base64!"));
    }
}
