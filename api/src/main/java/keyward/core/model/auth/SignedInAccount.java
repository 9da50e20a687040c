package keyward.core.model.auth;

/**
 * Account record as returned by the account directory, scoped to one organization.
 *
 * @param userId         account id
 * @param orgId          organization the record is scoped to
 * @param orgName        name of that organization
 * @param orgRole        role the account holds in that organization
 * @param login          login name
 * @param name           display name
 * @param email          email address (may be empty for service accounts)
 * @param disabled       whether the account is disabled
 * @param serverAdmin    whether the account is a server-wide administrator
 */
public record SignedInAccount(
        long userId,
        long orgId,
        String orgName,
        OrgRole orgRole,
        String login,
        String name,
        String email,
        boolean disabled,
        boolean serverAdmin) {

    public SignedInAccount {
        if (orgRole == null) {
            orgRole = OrgRole.NONE;
        }
        if (login == null) {
            login = "";
        }
        if (name == null) {
            name = login;
        }
        if (email == null) {
            email = "";
        }
    }
}
