package keyward.core.port.in;

import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.AuthnRequest;
import keyward.core.model.auth.Identity;

/**
 * Use case for resolving an inbound request into a caller identity.
 */
public interface Authentication {

    /**
     * Whether any registered client recognizes credentials on the request.
     *
     * <p>Cheap and side-effect free; never touches storage.
     */
    boolean canAuthenticate(AuthnRequest request);

    /**
     * Authenticate the request with the first client that recognizes it.
     *
     * @param request the inbound request
     * @return Uni with the resolved identity, failing with
     *         {@link keyward.core.model.auth.AuthnException} when authentication is refused
     */
    Uni<Identity> authenticate(AuthnRequest request);
}
