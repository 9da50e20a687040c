package keyward.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import keyward.core.model.auth.AuthnRequest;

/**
 * Pulls an API key out of a request's Authorization header.
 *
 * <p>Two forms are accepted:
 * <pre>
 * Authorization: Bearer &lt;key&gt;
 * Authorization: Basic base64("api_key:" + &lt;key&gt;)
 * </pre>
 * Anything else, including a malformed Basic header, yields no key.
 */
@ApplicationScoped
public class ApiKeyTokenExtractor {

    static final String BEARER_PREFIX = "Bearer ";
    static final String BASIC_PREFIX = "Basic ";
    static final String BASIC_AUTH_USERNAME = "api_key";

    /**
     * Extract the raw key.
     *
     * @param request the inbound request
     * @return the key, or empty if the request does not carry a non-empty one
     */
    public Optional<String> extract(AuthnRequest request) {
        return request.authorizationHeader().flatMap(this::fromHeader).filter(token -> !token.isEmpty());
    }

    private Optional<String> fromHeader(String header) {
        if (header.startsWith(BEARER_PREFIX)) {
            return Optional.of(header.substring(BEARER_PREFIX.length()));
        }
        if (header.startsWith(BASIC_PREFIX)) {
            return decodeBasic(header.substring(BASIC_PREFIX.length()))
                    .filter(credentials -> BASIC_AUTH_USERNAME.equals(credentials[0]))
                    .map(credentials -> credentials[1]);
        }
        return Optional.empty();
    }

    private Optional<String[]> decodeBasic(String encoded) {
        final String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int separator = decoded.indexOf(':');
        if (separator < 0) {
            return Optional.empty();
        }
        return Optional.of(new String[] {decoded.substring(0, separator), decoded.substring(separator + 1)});
    }
}
