package keyward.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Nested
    @DisplayName("sha256Hex")
    class Sha256HexTests {

        @Test
        @DisplayName("should match the standard test vector")
        void shouldMatchStandardVector() {
            assertEquals(
                    "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", SecureHash.sha256Hex("abc"));
        }

        @Test
        @DisplayName("should produce 64 lowercase hex characters")
        void shouldProduceLowercaseHex() {
            var hash = SecureHash.sha256Hex("some-secret");

            assertEquals(64, hash.length());
            assertTrue(hash.matches("[0-9a-f]+"));
        }
    }

    @Nested
    @DisplayName("pbkdf2Hex")
    class Pbkdf2HexTests {

        @Test
        @DisplayName("should produce a 50 byte digest")
        void shouldProduceFiftyByteDigest() {
            assertEquals(100, SecureHash.pbkdf2Hex("secret", "key-name").length());
        }

        @Test
        @DisplayName("should be deterministic for the same password and salt")
        void shouldBeDeterministic() {
            assertEquals(SecureHash.pbkdf2Hex("secret", "key-name"), SecureHash.pbkdf2Hex("secret", "key-name"));
        }

        @Test
        @DisplayName("should depend on the salt")
        void shouldDependOnSalt() {
            assertNotEquals(SecureHash.pbkdf2Hex("secret", "key-a"), SecureHash.pbkdf2Hex("secret", "key-b"));
        }
    }

    @Nested
    @DisplayName("crc32Hex")
    class Crc32HexTests {

        @Test
        @DisplayName("should match the standard check value")
        void shouldMatchCheckValue() {
            assertEquals("cbf43926", SecureHash.crc32Hex("123456789"));
        }

        @Test
        @DisplayName("should zero-pad to 8 characters")
        void shouldZeroPad() {
            assertEquals("00000000", SecureHash.crc32Hex(""));
        }
    }
}
