package keyward.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Set;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import keyward.core.model.auth.AuthnError;
import keyward.core.model.auth.AuthnException;
import keyward.core.model.auth.AuthnRequest;
import keyward.core.model.auth.Identity;
import keyward.core.model.auth.Namespace;
import keyward.core.model.auth.NamespacedId;
import keyward.core.model.auth.OrgRole;
import keyward.core.port.in.Authentication;

@DisplayName("AuthnIdentityProvider")
class AuthnIdentityProviderTest {

    private static final AuthnRequest REQUEST = AuthnRequest.withAuthorization("Bearer token");

    private AuthnIdentityProvider provider;
    private Authentication authentication;
    private AuthenticationRequestContext context;

    @BeforeEach
    void setUp() {
        authentication = mock(Authentication.class);
        context = mock(AuthenticationRequestContext.class);
        provider = new AuthnIdentityProvider(authentication);
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should build a SecurityIdentity from the resolved identity")
        void shouldBuildSecurityIdentity() {
            var identity = new Identity(
                            NamespacedId.of(Namespace.API_KEY, 42),
                            1,
                            "Main Org",
                            Map.of(1L, OrgRole.EDITOR),
                            "",
                            "",
                            "",
                            false,
                            null)
                    .authenticatedBy("auth.client.api-key");
            when(authentication.authenticate(REQUEST)).thenReturn(Uni.createFrom().item(identity));

            var result = provider.authenticate(new AuthnAuthenticationRequest(REQUEST), context)
                    .await()
                    .indefinitely();

            assertEquals("api-key:42", result.getPrincipal().getName());
            assertEquals(Set.of("editor"), result.getRoles());
            assertSame(identity, result.getAttribute(AuthnIdentityProvider.IDENTITY_ATTRIBUTE));
            assertEquals(1L, (Long) result.getAttribute("orgId"));
            assertEquals("auth.client.api-key", result.getAttribute("authenticatedBy"));
        }

        @Test
        @DisplayName("should add the server admin role")
        void shouldAddServerAdminRole() {
            var identity = new Identity(
                    NamespacedId.of(Namespace.SERVICE_ACCOUNT, 7),
                    1,
                    "",
                    Map.of(1L, OrgRole.ADMIN),
                    "sa-bot",
                    "",
                    "",
                    true,
                    null);

            var result = AuthnIdentityProvider.buildIdentity(identity);

            assertTrue(result.hasRole("admin"));
            assertTrue(result.hasRole(AuthnIdentityProvider.SERVER_ADMIN_ROLE));
        }

        @Test
        @DisplayName("should expose only the public message of a refusal")
        void shouldTranslateRefusal() {
            var refusal = new AuthnException(AuthnError.API_KEY_EXPIRED, "API key 42 has expired");
            when(authentication.authenticate(REQUEST)).thenReturn(Uni.createFrom().failure(refusal));

            var thrown = assertThrows(
                    AuthenticationFailedException.class,
                    () -> provider.authenticate(new AuthnAuthenticationRequest(REQUEST), context)
                            .await()
                            .indefinitely());

            assertEquals("Expired API key", thrown.getMessage());
            assertSame(refusal, thrown.getCause());
        }

        @Test
        @DisplayName("should not translate infrastructure failures")
        void shouldPassInfrastructureFailuresThrough() {
            var outage = new IllegalStateException("database unavailable");
            when(authentication.authenticate(REQUEST)).thenReturn(Uni.createFrom().failure(outage));

            var thrown = assertThrows(
                    RuntimeException.class,
                    () -> provider.authenticate(new AuthnAuthenticationRequest(REQUEST), context)
                            .await()
                            .indefinitely());

            assertInstanceOf(IllegalStateException.class, thrown);
        }
    }
}
