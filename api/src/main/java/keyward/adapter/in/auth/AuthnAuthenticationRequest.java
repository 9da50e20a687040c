package keyward.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

import keyward.core.model.auth.AuthnRequest;

/**
 * Authentication request carrying the credentials of an HTTP request.
 *
 * <p>This is the credential holder passed from {@link AuthnHttpAuthenticationMechanism}
 * to {@link AuthnIdentityProvider} during Quarkus Security authentication.
 */
public class AuthnAuthenticationRequest extends BaseAuthenticationRequest {

    private final AuthnRequest request;

    public AuthnAuthenticationRequest(AuthnRequest request) {
        this.request = request;
    }

    public AuthnRequest getRequest() {
        return request;
    }
}
