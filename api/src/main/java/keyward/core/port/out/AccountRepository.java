package keyward.core.port.out;

import io.smallrye.mutiny.Uni;

import keyward.core.model.auth.SignedInAccount;

/**
 * Port interface for the account directory that owns users and service accounts.
 */
public interface AccountRepository {

    /**
     * Load an account as seen from one organization.
     *
     * @param accountId the account id
     * @param orgId     the organization to scope the record to
     * @return Uni with the account, failing with
     *         {@link keyward.core.model.auth.AccountNotFoundException} when it does not exist
     */
    Uni<SignedInAccount> getSignedInAccount(long accountId, long orgId);
}
