package keyward.core.model.auth;

/**
 * The account directory has no account with the requested id in the requested organization.
 */
public class AccountNotFoundException extends RuntimeException {

    private final long accountId;
    private final long orgId;

    public AccountNotFoundException(long accountId, long orgId) {
        super("Account " + accountId + " not found in org " + orgId);
        this.accountId = accountId;
        this.orgId = orgId;
    }

    public long accountId() {
        return accountId;
    }

    public long orgId() {
        return orgId;
    }
}
