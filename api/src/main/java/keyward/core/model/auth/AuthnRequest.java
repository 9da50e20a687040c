package keyward.core.model.auth;

import java.util.Optional;

/**
 * Read-only view of an inbound request as seen by authentication clients.
 *
 * <p>Only the HTTP {@code Authorization} header is exposed. A request that did
 * not arrive over HTTP carries no header at all.
 *
 * @param authorization raw value of the Authorization header, or null
 */
public record AuthnRequest(String authorization) {

    private static final AuthnRequest EMPTY = new AuthnRequest(null);

    public static AuthnRequest withAuthorization(String authorization) {
        return new AuthnRequest(authorization);
    }

    public static AuthnRequest empty() {
        return EMPTY;
    }

    public Optional<String> authorizationHeader() {
        return Optional.ofNullable(authorization);
    }
}
