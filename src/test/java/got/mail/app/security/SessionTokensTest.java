package got.mail.app.security;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionTokensTest {

    @Test
    void newToken_ShouldBeUrlSafeAndUnpadded() {
        String token = SessionTokens.newToken();

        // 32 bytes encode to 43 Base64 characters without padding
        assertEquals(43, token.length());
        assertTrue(token.matches("[A-Za-z0-9_-]+"));
    }

    @Test
    void newToken_ShouldNotRepeat() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(SessionTokens.newToken());
        }
        assertEquals(1000, tokens.size());
    }

    @Test
    void digest_ShouldBeStableLowercaseSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", SessionTokens.digest("abc"));
        assertEquals(SessionTokens.digest("token"), SessionTokens.digest("token"));
        assertNotEquals(SessionTokens.digest("token"), SessionTokens.digest("token2"));
    }
}
