package keyward.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import keyward.adapter.out.storage.memory.InMemoryApiKeyRepository;
import keyward.core.model.auth.InvalidApiKeyException;
import keyward.core.model.auth.LegacyApiKey;
import keyward.core.port.out.ApiKeyRepository;

@DisplayName("ApiKeyResolver")
class ApiKeyResolverTest {

    private InMemoryApiKeyRepository repository;
    private ApiKeyResolver resolver;

    @BeforeEach
    void setUp() {
        repository = new InMemoryApiKeyRepository();
        resolver = new ApiKeyResolver(repository);
    }

    @Nested
    @DisplayName("prefixed keys")
    class PrefixedTests {

        @Test
        @DisplayName("should find the record by secret hash")
        void shouldFindByHash() {
            var key = TestApiKeys.prefixed("secret-1");
            repository.save(TestApiKeys.storedFor(10, key).build()).await().indefinitely();

            var found = resolver.resolve(key).await().indefinitely();

            assertEquals(10, found.id());
        }

        @Test
        @DisplayName("should fail as invalid when no record matches")
        void shouldFailWhenNoRecordMatches() {
            var key = TestApiKeys.prefixed("unknown");

            assertThrows(
                    InvalidApiKeyException.class,
                    () -> resolver.resolve(key).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("legacy keys")
    class LegacyTests {

        @Test
        @DisplayName("should find by name and verify the secret")
        void shouldFindAndVerify() {
            var key = TestApiKeys.legacy("legacy-secret", "ci");
            repository.save(TestApiKeys.storedFor(20, key).build()).await().indefinitely();

            var found = resolver.resolve(key).await().indefinitely();

            assertEquals(20, found.id());
        }

        @Test
        @DisplayName("should fail as invalid when the secret does not verify")
        void shouldFailWhenSecretDoesNotVerify() {
            var stored = TestApiKeys.legacy("legacy-secret", "ci");
            repository.save(TestApiKeys.storedFor(20, stored).build()).await().indefinitely();
            var presented = new LegacyApiKey("wrong-secret", "ci", stored.orgId());

            assertThrows(
                    InvalidApiKeyException.class,
                    () -> resolver.resolve(presented).await().indefinitely());
        }

        @Test
        @DisplayName("should fail as invalid when the name is unknown in the org")
        void shouldFailWhenNameUnknown() {
            var stored = TestApiKeys.legacy("legacy-secret", "ci");
            repository.save(TestApiKeys.storedFor(20, stored).build()).await().indefinitely();
            var otherOrg = new LegacyApiKey("legacy-secret", "ci", 99);

            assertThrows(
                    InvalidApiKeyException.class,
                    () -> resolver.resolve(otherOrg).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("verification executor")
    class VerificationExecutorTests {

        private final AtomicInteger handoffs = new AtomicInteger();
        private final Executor counting = task -> {
            handoffs.incrementAndGet();
            task.run();
        };

        @Test
        @DisplayName("should hand legacy verification to the verification executor")
        void shouldOffloadLegacyVerification() {
            var key = TestApiKeys.legacy("legacy-secret", "ci");
            repository.save(TestApiKeys.storedFor(30, key).build()).await().indefinitely();

            var found = new ApiKeyResolver(repository, counting)
                    .resolve(key)
                    .await()
                    .indefinitely();

            assertEquals(30, found.id());
            assertEquals(1, handoffs.get());
        }

        @Test
        @DisplayName("should resolve prefixed keys without a handoff")
        void shouldNotOffloadHashLookup() {
            var key = TestApiKeys.prefixed("secret-3");
            repository.save(TestApiKeys.storedFor(31, key).build()).await().indefinitely();

            new ApiKeyResolver(repository, counting).resolve(key).await().indefinitely();

            assertEquals(0, handoffs.get());
        }
    }

    @Test
    @DisplayName("should pass repository failures through unchanged")
    void shouldPassRepositoryFailuresThrough() {
        var failing = mock(ApiKeyRepository.class);
        var outage = new IllegalStateException("storage unavailable");
        when(failing.findByHash(anyString())).thenReturn(Uni.createFrom().failure(outage));

        var thrown = assertThrows(
                IllegalStateException.class,
                () -> new ApiKeyResolver(failing)
                        .resolve(TestApiKeys.prefixed("secret"))
                        .await()
                        .indefinitely());

        assertSame(outage, thrown);
    }
}
