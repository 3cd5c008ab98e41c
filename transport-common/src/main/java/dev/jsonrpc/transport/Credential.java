package dev.jsonrpc.transport;

import java.util.Objects;

/**
 * API key or token sent along with a request. The transport only uses {@link #asHeader()}; the
 * other renderings are there for services that expect the key elsewhere.
 */
public record Credential(String name, String value) {

    public Credential {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) {
            throw new IllegalArgumentException("credential name must not be blank");
        }
    }

    /**
     * Parses {@code NAME=VALUE}, splitting at the first {@code =}.
     */
    public static Credential parse(String assignment) {
        int eq = Objects.requireNonNull(assignment, "assignment").indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Expected NAME=VALUE but got: " + assignment);
        }
        return new Credential(assignment.substring(0, eq), assignment.substring(eq + 1));
    }

    public String asHeader() {
        return name + ": " + value;
    }

    public String asQueryString() {
        return name + "=" + value;
    }

    public String asCookie() {
        return "Cookie: " + name + "=" + value;
    }

    @Override
    public String toString() {
        return "Credential[name=" + name + ", value=****]";
    }
}
