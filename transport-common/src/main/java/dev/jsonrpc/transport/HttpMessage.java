package dev.jsonrpc.transport;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A received HTTP/1.1 message split into its header block and its body. The header block holds
 * the start line followed by the header lines, without the terminating blank line.
 */
public record HttpMessage(String head, String body) {

    public String startLine() {
        int end = head.indexOf(HttpFrameCodec.CRLF);
        return end < 0 ? head : head.substring(0, end);
    }

    /**
     * Status code of a response start line such as {@code HTTP/1.1 200 OK}, if it has one.
     */
    public OptionalInt statusCode() {
        String[] parts = startLine().split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * First header with the given name, compared case-insensitively.
     */
    public Optional<String> header(String name) {
        return header(head, name);
    }

    static Optional<String> header(String head, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        String[] lines = head.split(HttpFrameCodec.CRLF);
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon > 0 && lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(lines[i].substring(colon + 1).trim());
            }
        }
        return Optional.empty();
    }
}
