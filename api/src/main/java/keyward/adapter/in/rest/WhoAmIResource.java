package keyward.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;

import keyward.adapter.in.auth.AuthnIdentityProvider;
import keyward.adapter.in.dto.IdentityResponse;
import keyward.core.model.auth.Identity;

/**
 * Returns the identity the caller's credentials resolve to.
 */
@Path("/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

    private final SecurityIdentity securityIdentity;

    @Inject
    public WhoAmIResource(SecurityIdentity securityIdentity) {
        this.securityIdentity = securityIdentity;
    }

    @GET
    @Authenticated
    public IdentityResponse whoAmI() {
        Identity identity = securityIdentity.getAttribute(AuthnIdentityProvider.IDENTITY_ATTRIBUTE);
        return IdentityResponse.fromIdentity(identity);
    }
}
