package keyward.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.ApiKey;
import keyward.core.model.auth.AuthnError;
import keyward.core.model.auth.AuthnException;
import keyward.core.model.auth.Identity;
import keyward.core.model.auth.Namespace;
import keyward.core.model.auth.NamespacedId;
import keyward.core.port.out.AccountRepository;

/**
 * Turns a valid key record into the caller's identity.
 *
 * <p>A key without a linked service account is its own principal, holding its
 * role in its organization. A key linked to a service account authenticates as
 * that account, with the account's own roles.
 */
@ApplicationScoped
public class ApiKeyIdentityResolver {

    private final AccountRepository accountRepository;

    @Inject
    public ApiKeyIdentityResolver(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    public Uni<Identity> resolve(ApiKey apiKey) {
        if (!apiKey.hasServiceAccount()) {
            return Uni.createFrom().item(Identity.forApiKey(apiKey));
        }

        return accountRepository
                .getSignedInAccount(apiKey.serviceAccountId(), apiKey.orgId())
                .map(account -> {
                    if (account.disabled()) {
                        throw new AuthnException(
                                AuthnError.SERVICE_ACCOUNT_DISABLED,
                                "Service account " + account.userId() + " linked to API key " + apiKey.id()
                                        + " is disabled");
                    }
                    return Identity.fromSignedInAccount(
                            NamespacedId.of(Namespace.SERVICE_ACCOUNT, account.userId()), account);
                });
    }
}
