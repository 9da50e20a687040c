package keyward.core.model.auth;

import java.util.Map;
import java.util.Optional;

/**
 * Resolved caller identity produced by an authentication client.
 *
 * <p>Identities are built fresh for each request and never cached here.
 *
 * @param id              namespaced principal id
 * @param orgId           organization the request is scoped to
 * @param orgName         name of that organization (may be empty)
 * @param orgRoles        role held per organization id
 * @param login           login name (empty for raw API keys)
 * @param name            display name (empty for raw API keys)
 * @param email           email address (may be empty)
 * @param serverAdmin     whether the principal is a server-wide administrator
 * @param authenticatedBy name of the client that produced this identity
 */
public record Identity(
        NamespacedId id,
        long orgId,
        String orgName,
        Map<Long, OrgRole> orgRoles,
        String login,
        String name,
        String email,
        boolean serverAdmin,
        String authenticatedBy) {

    public Identity {
        if (id == null) {
            throw new IllegalArgumentException("Identity id cannot be null");
        }
        orgRoles = orgRoles != null ? Map.copyOf(orgRoles) : Map.of();
        orgName = orgName != null ? orgName : "";
        login = login != null ? login : "";
        name = name != null ? name : "";
        email = email != null ? email : "";
    }

    /**
     * Identity of a raw API key: its single org and role.
     */
    public static Identity forApiKey(ApiKey apiKey) {
        var roles = apiKey.role() != null ? Map.of(apiKey.orgId(), apiKey.role()) : Map.<Long, OrgRole>of();
        return new Identity(
                NamespacedId.of(Namespace.API_KEY, apiKey.id()), apiKey.orgId(), "", roles, "", "", "", false, null);
    }

    /**
     * Identity taken from an account record; the account's own org and role are authoritative.
     */
    public static Identity fromSignedInAccount(NamespacedId id, SignedInAccount account) {
        return new Identity(
                id,
                account.orgId(),
                account.orgName(),
                Map.of(account.orgId(), account.orgRole()),
                account.login(),
                account.name(),
                account.email(),
                account.serverAdmin(),
                null);
    }

    /**
     * Role held in the identity's own organization.
     */
    public Optional<OrgRole> role() {
        return Optional.ofNullable(orgRoles.get(orgId));
    }

    public Identity authenticatedBy(String client) {
        return new Identity(id, orgId, orgName, orgRoles, login, name, email, serverAdmin, client);
    }
}
