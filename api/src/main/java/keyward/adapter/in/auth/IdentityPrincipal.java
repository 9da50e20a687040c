package keyward.adapter.in.auth;

import java.security.Principal;

import keyward.core.model.auth.NamespacedId;

/**
 * Principal named by a namespaced id.
 */
public record IdentityPrincipal(NamespacedId id) implements Principal {

    @Override
    public String getName() {
        return id.toString();
    }
}
