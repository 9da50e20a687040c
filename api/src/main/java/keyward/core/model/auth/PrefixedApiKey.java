package keyward.core.model.auth;

import keyward.core.util.SecureHash;

/**
 * Current-format key: {@code gl<serviceId>_<secret>_<checksum>}.
 *
 * <p>The checksum is the CRC-32 of everything before the last separator, so a
 * mistyped key is rejected before any storage access. The stored record is
 * found by the SHA-256 of the secret.
 *
 * @param serviceId short service tag following the prefix (e.g. "sa")
 * @param secret    random secret part
 * @param checksum  8 hex digit CRC-32 of {@code gl<serviceId>_<secret>}
 */
public record PrefixedApiKey(String serviceId, String secret, String checksum) implements DecodedApiKey {

    public static final String PREFIX = "gl";
    public static final String SEPARATOR = "_";

    /**
     * Recompute the checksum over the key body.
     */
    public String calculateChecksum() {
        return SecureHash.crc32Hex(PREFIX + serviceId + SEPARATOR + secret);
    }

    /**
     * Lookup hash under which the stored record is indexed.
     */
    public String hash() {
        return SecureHash.sha256Hex(secret);
    }

    @Override
    public String toString() {
        return "PrefixedApiKey[serviceId=" + serviceId + ", secret=[REDACTED]]";
    }
}
