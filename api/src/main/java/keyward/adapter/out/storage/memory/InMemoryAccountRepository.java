package keyward.adapter.out.storage.memory;

import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.AccountNotFoundException;
import keyward.core.model.auth.SignedInAccount;
import keyward.core.port.out.AccountRepository;

/**
 * In-memory account directory keyed by (account id, org id).
 *
 * <p>Data is NOT persisted across restarts. Any other {@link AccountRepository}
 * bean replaces this one.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryAccountRepository implements AccountRepository {

    private final ConcurrentHashMap<String, SignedInAccount> accounts = new ConcurrentHashMap<>();

    /**
     * Add or replace an account's record for its organization.
     */
    public void save(SignedInAccount account) {
        accounts.put(key(account.userId(), account.orgId()), account);
    }

    @Override
    public Uni<SignedInAccount> getSignedInAccount(long accountId, long orgId) {
        return Uni.createFrom().item(() -> {
            var account = accounts.get(key(accountId, orgId));
            if (account == null) {
                throw new AccountNotFoundException(accountId, orgId);
            }
            return account;
        });
    }

    private static String key(long accountId, long orgId) {
        return accountId + "/" + orgId;
    }
}
