package tech.yump.secretsync.backend.local;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM sealing of local vault values under the vault's master key.
 * <p>
 * Every value is sealed together with a binding context (secret name and version) passed as
 * associated data, so a sealed value only opens under the context it was written for.
 */
@Slf4j
public class EncryptionService {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int NONCE_LENGTH_BYTE = 12;
    public static final int TAG_LENGTH_BYTE = 16;
    public static final int KEY_LENGTH_BYTE = 32;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    /**
     * Output of {@link #seal}: the random nonce and the ciphertext with its appended GCM tag.
     */
    public record Sealed(byte[] nonce, byte[] ciphertext) {}

    private final SecretKey masterKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public EncryptionService(SecretKey masterKey) {
        this.masterKey = masterKey;
    }

    /**
     * Decodes a Base64 master key.
     *
     * @throws IllegalArgumentException if the text is not Base64 or not {@value #KEY_LENGTH_BYTE} bytes long
     */
    public static SecretKey keyFromBase64(String base64Key) {
        byte[] bytes = Base64.getDecoder().decode(base64Key.trim());
        try {
            if (bytes.length != KEY_LENGTH_BYTE) {
                throw new IllegalArgumentException("Master key must be " + KEY_LENGTH_BYTE + " bytes, got " + bytes.length);
            }
            return new SecretKeySpec(bytes, "AES");
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    public Sealed seal(byte[] plaintext, String context) {
        if (plaintext == null || context == null) {
            throw new EncryptionException("Plaintext and context must be provided.");
        }
        byte[] nonce = new byte[NONCE_LENGTH_BYTE];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = cipher(Cipher.ENCRYPT_MODE, nonce, context);
            Sealed sealed = new Sealed(nonce, cipher.doFinal(plaintext));
            log.trace("Sealed {} bytes for '{}'", plaintext.length, context);
            return sealed;
        } catch (GeneralSecurityException e) {
            log.error("Sealing value for '{}' failed: {}", context, e.getMessage(), e);
            throw new EncryptionException("Failed to encrypt value for '" + context + "'.", e);
        }
    }

    /**
     * Verifies the tag and decrypts.
     *
     * @throws EncryptionException if the key or the context differs from sealing time, or the data was altered
     */
    public byte[] open(Sealed sealed, String context) {
        if (sealed.nonce() == null || sealed.nonce().length != NONCE_LENGTH_BYTE) {
            throw new EncryptionException("Invalid nonce: expected " + NONCE_LENGTH_BYTE + " bytes.");
        }
        if (sealed.ciphertext() == null || sealed.ciphertext().length < TAG_LENGTH_BYTE) {
            throw new EncryptionException("Invalid ciphertext: shorter than the authentication tag.");
        }
        try {
            return cipher(Cipher.DECRYPT_MODE, sealed.nonce(), context).doFinal(sealed.ciphertext());
        } catch (AEADBadTagException e) {
            log.warn("Authentication tag mismatch for '{}' (wrong master key, moved or tampered file)", context);
            throw new EncryptionException("Authentication failed for '" + context + "'.", e);
        } catch (GeneralSecurityException e) {
            log.error("Opening value for '{}' failed: {}", context, e.getMessage(), e);
            throw new EncryptionException("Failed to decrypt value for '" + context + "'.", e);
        }
    }

    private Cipher cipher(int mode, byte[] nonce, String context) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, masterKey, new GCMParameterSpec(TAG_LENGTH_BYTE * 8, nonce));
        cipher.updateAAD(context.getBytes(StandardCharsets.UTF_8));
        return cipher;
    }

    public static class EncryptionException extends RuntimeException {

        public EncryptionException(String message) {
            super(message);
        }

        public EncryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
