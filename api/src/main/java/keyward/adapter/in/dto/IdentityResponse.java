package keyward.adapter.in.dto;

import java.util.Map;
import java.util.TreeMap;

import keyward.core.model.auth.Identity;

/**
 * Caller identity as returned by {@code GET /whoami}.
 */
public record IdentityResponse(
        String id,
        String namespace,
        long orgId,
        String orgName,
        String role,
        Map<String, String> orgRoles,
        String login,
        String name,
        String email,
        boolean serverAdmin,
        String authenticatedBy) {

    public static IdentityResponse fromIdentity(Identity identity) {
        var roles = new TreeMap<String, String>();
        identity.orgRoles().forEach((org, role) -> roles.put(String.valueOf(org), role.value()));
        return new IdentityResponse(
                identity.id().toString(),
                identity.id().namespace().value(),
                identity.orgId(),
                identity.orgName(),
                identity.role().map(role -> role.value()).orElse(null),
                roles,
                identity.login(),
                identity.name(),
                identity.email(),
                identity.serverAdmin(),
                identity.authenticatedBy());
    }
}
