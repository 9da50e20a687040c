package keyward.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import java.util.HexFormat;
import java.util.zip.CRC32;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * Hashing primitives used by the API key formats.
 *
 * <p>All digests are returned as lowercase hex.
 */
public final class SecureHash {

    static final int PBKDF2_ITERATIONS = 10_000;
    static final int PBKDF2_KEY_LENGTH_BYTES = 50;

    private SecureHash() {}

    /**
     * SHA-256 of the UTF-8 bytes of {@code input}.
     */
    public static String sha256Hex(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every JVM", e);
        }
    }

    /**
     * PBKDF2-HMAC-SHA256 with 10000 iterations and a 50 byte output.
     *
     * @param password the secret
     * @param salt     the salt, used as UTF-8 bytes
     * @return hex digest (100 characters)
     */
    public static String pbkdf2Hex(String password, String salt) {
        final var spec = new PBEKeySpec(
                password.toCharArray(),
                salt.getBytes(StandardCharsets.UTF_8),
                PBKDF2_ITERATIONS,
                PBKDF2_KEY_LENGTH_BYTES * 8);
        try {
            final var factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            return HexFormat.of().formatHex(factory.generateSecret(spec).getEncoded());
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * CRC-32 (IEEE) of the UTF-8 bytes of {@code input}, zero-padded to 8 hex digits.
     */
    public static String crc32Hex(String input) {
        final var crc = new CRC32();
        crc.update(input.getBytes(StandardCharsets.UTF_8));
        return String.format("%08x", crc.getValue());
    }
}
