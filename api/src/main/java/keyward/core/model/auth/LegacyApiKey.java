package keyward.core.model.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import keyward.core.util.SecureHash;

/**
 * Legacy-format key: Base64 JSON carrying the secret, the key name and the org id.
 *
 * <p>The stored record holds a PBKDF2 digest of the secret salted with the key
 * name, so the record has to be found by name first and then verified.
 *
 * @param key   plaintext secret
 * @param name  key name
 * @param orgId owning organization
 */
public record LegacyApiKey(String key, String name, long orgId) implements DecodedApiKey {

    public LegacyApiKey {
        key = key != null ? key : "";
        name = name != null ? name : "";
    }

    /**
     * Compute the stored representation of this key's secret.
     */
    public String storedSecret() {
        return SecureHash.pbkdf2Hex(key, name);
    }

    /**
     * Compare this key's secret with the stored digest in constant time.
     *
     * @param storedSecret digest held by the stored record
     * @return true if they match
     */
    public boolean verify(String storedSecret) {
        if (storedSecret == null || key.isEmpty() || name.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                storedSecret().getBytes(StandardCharsets.UTF_8), storedSecret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "LegacyApiKey[name=" + name + ", orgId=" + orgId + ", key=[REDACTED]]";
    }
}
