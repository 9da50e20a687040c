package keyward.spi;

import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.AuthnRequest;
import keyward.core.model.auth.ClientParams;
import keyward.core.model.auth.Identity;

/**
 * Service Provider Interface for authentication clients.
 *
 * <p>Each client handles one kind of credential. Clients are discovered via CDI
 * and tried in descending {@link #priority()} order; the first one whose
 * {@link #test} accepts the request authenticates it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class RenderKeyClient implements AuthnClient {
 *     @Override
 *     public String name() { return "auth.client.render-key"; }
 *
 *     @Override
 *     public boolean test(AuthnRequest request) {
 *         return request.authorizationHeader().filter(h -> h.startsWith("Render ")).isPresent();
 *     }
 *
 *     @Override
 *     public Uni<Identity> authenticate(AuthnRequest request) {
 *         // Validate render key...
 *     }
 * }
 * }</pre>
 */
public interface AuthnClient {

    /**
     * Unique name identifying this client, used for logging and metrics.
     */
    String name();

    /**
     * Priority for client selection (higher = tried first).
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether this client should attempt to authenticate the request.
     *
     * <p>Must be cheap: no decoding, storage access or other fallible work.
     */
    boolean test(AuthnRequest request);

    /**
     * Authenticate a request this client accepted in {@link #test}.
     *
     * @param request the inbound request
     * @return Uni with the identity, failing with
     *         {@link keyward.core.model.auth.AuthnException} for unauthorized outcomes
     *         or with the collaborator's own exception for infrastructure faults
     */
    Uni<Identity> authenticate(AuthnRequest request);

    /**
     * Post-processing hints for the dispatcher.
     */
    default ClientParams clientParams() {
        return ClientParams.none();
    }
}
