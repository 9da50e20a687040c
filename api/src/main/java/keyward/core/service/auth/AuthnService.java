package keyward.core.service.auth;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyward.core.model.auth.AuthnError;
import keyward.core.model.auth.AuthnException;
import keyward.core.model.auth.AuthnRequest;
import keyward.core.model.auth.Identity;
import keyward.core.port.in.Authentication;
import keyward.core.port.out.Metrics;
import keyward.spi.AuthnClient;

/**
 * Dispatches requests to the registered {@link AuthnClient}s.
 *
 * <p>Clients are tried in descending priority order. The first client whose
 * {@link AuthnClient#test} accepts the request authenticates it; its outcome is
 * final and no other client is consulted.
 */
@ApplicationScoped
public class AuthnService implements Authentication {

    private static final Logger LOG = Logger.getLogger(AuthnService.class);

    private final List<AuthnClient> clients;
    private final Metrics metrics;

    @Inject
    public AuthnService(Instance<AuthnClient> clients, Metrics metrics) {
        this(clients.stream().toList(), metrics);
    }

    public AuthnService(List<AuthnClient> clients, Metrics metrics) {
        this.clients = clients.stream()
                .sorted(Comparator.comparingInt(AuthnClient::priority).reversed())
                .toList();
        this.metrics = metrics;
        LOG.debugf(
                "Registered authentication clients: %s",
                this.clients.stream().map(AuthnClient::name).toList());
    }

    @Override
    public boolean canAuthenticate(AuthnRequest request) {
        return findClient(request).isPresent();
    }

    @Override
    public Uni<Identity> authenticate(AuthnRequest request) {
        var client = findClient(request);
        if (client.isEmpty()) {
            metrics.recordAuthFailure(null, AuthnError.UNAUTHENTICATED.messageId());
            return Uni.createFrom()
                    .failure(new AuthnException(
                            AuthnError.UNAUTHENTICATED, "No authentication client accepted the request"));
        }

        var name = client.get().name();
        return client.get()
                .authenticate(request)
                .map(identity -> identity.authenticatedBy(name))
                .invoke(identity -> {
                    LOG.debugf("Authenticated %s via %s", identity.id(), name);
                    metrics.recordAuthSuccess(name);
                })
                .onFailure()
                .invoke(failure -> recordFailure(name, failure));
    }

    private Optional<AuthnClient> findClient(AuthnRequest request) {
        return clients.stream().filter(client -> client.test(request)).findFirst();
    }

    private void recordFailure(String client, Throwable failure) {
        if (failure instanceof AuthnException authnException) {
            LOG.debugf(
                    "Authentication via %s refused (%s): %s",
                    client, authnException.messageId(), authnException.getMessage());
            metrics.recordAuthFailure(client, authnException.messageId());
            return;
        }
        LOG.warnf("Authentication via %s failed: %s", client, failure.getMessage());
        metrics.recordAuthFailure(client, "error");
    }
}
