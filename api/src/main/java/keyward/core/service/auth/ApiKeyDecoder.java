package keyward.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;

import keyward.core.model.auth.DecodedApiKey;
import keyward.core.model.auth.InvalidApiKeyException;
import keyward.core.model.auth.LegacyApiKey;
import keyward.core.model.auth.PrefixedApiKey;

/**
 * Decodes raw tokens into {@link DecodedApiKey}s.
 *
 * <p>The format is picked once, by prefix: tokens starting with
 * {@link PrefixedApiKey#PREFIX} are current-format keys, everything else is
 * treated as a legacy key. Decoding is pure and never touches storage.
 */
@ApplicationScoped
public class ApiKeyDecoder {

    private final ObjectMapper objectMapper;

    @Inject
    public ApiKeyDecoder(ObjectMapper objectMapper) {
        this.objectMapper = strictScalars(objectMapper.copy());
    }

    /**
     * Legacy payload members must carry their own JSON type: a quoted or
     * fractional org id and a numeric secret or name are malformed keys.
     * Unknown members are ignored.
     */
    private static ObjectMapper strictScalars(ObjectMapper mapper) {
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Whether the token uses the current, prefixed format.
     */
    public static boolean isPrefixed(String token) {
        return token.startsWith(PrefixedApiKey.PREFIX);
    }

    /**
     * Decode a token.
     *
     * @param token the raw token
     * @return the decoded key
     * @throws InvalidApiKeyException if the token does not parse in its format
     */
    public DecodedApiKey decode(String token) {
        if (token == null || token.isEmpty()) {
            throw new InvalidApiKeyException("Empty API key");
        }
        return isPrefixed(token) ? decodePrefixed(token) : decodeLegacy(token);
    }

    PrefixedApiKey decodePrefixed(String token) {
        String[] parts = token.split(PrefixedApiKey.SEPARATOR, -1);
        if (parts.length != 3) {
            throw new InvalidApiKeyException("Prefixed API key has " + parts.length + " parts, expected 3");
        }
        var key = new PrefixedApiKey(parts[0].substring(PrefixedApiKey.PREFIX.length()), parts[1], parts[2]);
        if (!key.calculateChecksum().equals(key.checksum())) {
            throw new InvalidApiKeyException("Prefixed API key checksum mismatch");
        }
        return key;
    }

    LegacyApiKey decodeLegacy(String token) {
        final byte[] json;
        try {
            json = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            throw new InvalidApiKeyException("Legacy API key is not valid base64", e);
        }
        try {
            var payload = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), LegacyKeyPayload.class);
            if (payload == null) {
                throw new InvalidApiKeyException("Legacy API key payload is empty");
            }
            return new LegacyApiKey(payload.key(), payload.name(), payload.orgId());
        } catch (JsonProcessingException e) {
            throw new InvalidApiKeyException("Legacy API key is not valid JSON", e);
        }
    }

    record LegacyKeyPayload(
            @JsonProperty("k") String key, @JsonProperty("n") String name, @JsonProperty("id") long orgId) {}
}
