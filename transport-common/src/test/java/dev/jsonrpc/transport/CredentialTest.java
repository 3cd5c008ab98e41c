package dev.jsonrpc.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CredentialTest {

    @Test
    void rendersInEachFormat() {
        Credential credential = new Credential("API_KEY", "my-api-key.xxx.yyy.zzz");

        assertEquals("API_KEY: my-api-key.xxx.yyy.zzz", credential.asHeader());
        assertEquals("API_KEY=my-api-key.xxx.yyy.zzz", credential.asQueryString());
        assertEquals("Cookie: API_KEY=my-api-key.xxx.yyy.zzz", credential.asCookie());
    }

    @Test
    void parsesAssignment() {
        assertEquals(new Credential("API-KEY", "a=b"), Credential.parse("API-KEY=a=b"));
        assertThrows(IllegalArgumentException.class, () -> Credential.parse("=value"));
        assertThrows(IllegalArgumentException.class, () -> Credential.parse("no-separator"));
    }

    @Test
    void doesNotPrintSecret() {
        assertFalse(new Credential("API-KEY", "secret").toString().contains("secret"));
    }
}
