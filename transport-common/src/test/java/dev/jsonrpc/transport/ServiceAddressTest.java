package dev.jsonrpc.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ServiceAddressTest {

    @Test
    void normalizesSlashes() {
        ServiceAddress address = new ServiceAddress("host:port/", "/path/");

        assertEquals("host:port", address.hostPort());
        assertEquals("path", address.path());
        assertEquals("host:port/path", address.fullPath());
        assertEquals("/path", address.requestTarget());
    }

    @Test
    void normalizationIsIdempotent() {
        ServiceAddress once = new ServiceAddress("localhost:8082//", "//math-api");
        ServiceAddress twice = new ServiceAddress(once.hostPort(), once.path());

        assertEquals(once, twice);
        assertEquals("localhost:8082/math-api", twice.fullPath());
    }

    @Test
    void emptyPathTargetsRoot() {
        ServiceAddress address = new ServiceAddress("localhost:8082", "/");

        assertEquals("", address.path());
        assertEquals("/", address.requestTarget());
    }

    @Test
    void splitsHostAndPort() {
        ServiceAddress address = new ServiceAddress("example.org:8082", "api");

        assertEquals("example.org", address.host());
        assertEquals(8082, address.port());
        assertEquals(80, new ServiceAddress("example.org", "api").port());
    }

    @Test
    void supportsIpv6Literals() {
        ServiceAddress address = new ServiceAddress("[::1]:9000", "rpc");

        assertEquals("::1", address.host());
        assertEquals(9000, address.port());
        assertEquals(80, new ServiceAddress("[::1]", "rpc").port());
    }

    @Test
    void parsesUrlStyleAddresses() {
        ServiceAddress address = ServiceAddress.parse("http://localhost:8082/math-api");

        assertEquals("localhost:8082", address.hostPort());
        assertEquals("math-api", address.path());
        assertEquals(new ServiceAddress("localhost:8082", ""), ServiceAddress.parse("localhost:8082"));
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceAddress("/", "path"));
        assertThrows(IllegalArgumentException.class, () -> new ServiceAddress("localhost:http", "path").port());
    }
}
