package keyward.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ApiKey")
class ApiKeyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static ApiKey.Builder key() {
        return ApiKey.builder(1, "stored").orgId(1).name("key");
    }

    @Test
    @DisplayName("should reject blank name or secret")
    void shouldRejectBlankFields() {
        assertThrows(IllegalArgumentException.class, () -> ApiKey.builder(1, "stored").name(" ").build());
        assertThrows(IllegalArgumentException.class, () -> ApiKey.builder(1, "").name("key").build());
    }

    @Nested
    @DisplayName("isExpiredAt")
    class ExpiryTests {

        @Test
        @DisplayName("should never expire without an expiry")
        void shouldNotExpireWithoutExpiry() {
            assertFalse(key().build().isExpiredAt(NOW));
        }

        @Test
        @DisplayName("should be expired exactly at the expiry second")
        void shouldBeExpiredAtExpirySecond() {
            assertTrue(key().expires(NOW.getEpochSecond()).build().isExpiredAt(NOW));
        }

        @Test
        @DisplayName("should not be expired before the expiry second")
        void shouldNotBeExpiredBefore() {
            assertFalse(key().expiresAt(NOW.plusSeconds(1)).build().isExpiredAt(NOW));
        }
    }

    @Nested
    @DisplayName("flags")
    class FlagTests {

        @Test
        @DisplayName("should treat a missing revoked flag as not revoked")
        void shouldTreatNullRevokedAsFalse() {
            assertFalse(key().revoked(null).build().isRevoked());
            assertTrue(key().revoked(true).build().isRevoked());
        }

        @Test
        @DisplayName("should only delegate to positive service account ids")
        void shouldOnlyDelegateToPositiveIds() {
            assertFalse(key().build().hasServiceAccount());
            assertFalse(key().serviceAccountId(0L).build().hasServiceAccount());
            assertFalse(key().serviceAccountId(-3L).build().hasServiceAccount());
            assertTrue(key().serviceAccountId(5L).build().hasServiceAccount());
        }

        @Test
        @DisplayName("should keep other fields when stamping last use")
        void shouldKeepFieldsWhenStampingLastUse() {
            var apiKey = key().role(OrgRole.EDITOR).build();

            var used = apiKey.withLastUsedAt(NOW);

            assertEquals(NOW, used.lastUsedAt());
            assertEquals(OrgRole.EDITOR, used.role());
            assertEquals(apiKey.created(), used.created());
        }
    }
}
