package keyward.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.AuthnException;
import keyward.core.model.auth.Identity;
import keyward.core.port.in.Authentication;

/**
 * Quarkus identity provider that resolves requests through {@link Authentication}
 * and builds a SecurityIdentity.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal name: the namespaced id (e.g. {@code api-key:42})</li>
 *   <li>Roles: the lowercase org role in the identity's organization, plus
 *       {@code server-admin} for server administrators</li>
 *   <li>Attributes: {@code identity}, {@code orgId}, {@code authenticatedBy}</li>
 * </ul>
 *
 * <p>Refused authentication becomes an {@link AuthenticationFailedException}
 * carrying the public message, with the {@link AuthnException} as its cause.
 */
@ApplicationScoped
public class AuthnIdentityProvider implements IdentityProvider<AuthnAuthenticationRequest> {

    public static final String IDENTITY_ATTRIBUTE = "identity";
    public static final String SERVER_ADMIN_ROLE = "server-admin";

    private final Authentication authentication;

    @Inject
    public AuthnIdentityProvider(Authentication authentication) {
        this.authentication = authentication;
    }

    @Override
    public Class<AuthnAuthenticationRequest> getRequestType() {
        return AuthnAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            AuthnAuthenticationRequest request, AuthenticationRequestContext context) {
        return authentication
                .authenticate(request.getRequest())
                .onFailure(AuthnException.class)
                .transform(e -> new AuthenticationFailedException(((AuthnException) e).publicMessage(), e))
                .map(AuthnIdentityProvider::buildIdentity);
    }

    static SecurityIdentity buildIdentity(Identity identity) {
        var builder = QuarkusSecurityIdentity.builder()
                .setPrincipal(new IdentityPrincipal(identity.id()))
                .addAttribute(IDENTITY_ATTRIBUTE, identity)
                .addAttribute("orgId", identity.orgId());

        identity.role().ifPresent(role -> builder.addRole(role.value().toLowerCase()));
        if (identity.serverAdmin()) {
            builder.addRole(SERVER_ADMIN_ROLE);
        }
        if (identity.authenticatedBy() != null) {
            builder.addAttribute("authenticatedBy", identity.authenticatedBy());
        }

        return builder.build();
    }
}
