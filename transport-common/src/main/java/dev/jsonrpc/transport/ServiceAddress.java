package dev.jsonrpc.transport;

import java.util.Objects;

/**
 * Target of a call: the {@code host:port} to connect to and the request path on that host.
 * Both parts are normalized on construction so that {@link #fullPath()} always joins them with
 * exactly one slash.
 */
public record ServiceAddress(String hostPort, String path) {

    private static final int DEFAULT_PORT = 80;
    private static final String HTTP_SCHEME = "http://";

    public ServiceAddress {
        hostPort = stripTrailing(Objects.requireNonNull(hostPort, "hostPort"));
        path = stripTrailing(stripLeading(Objects.requireNonNull(path, "path")));
        if (hostPort.isEmpty()) {
            throw new IllegalArgumentException("hostPort must not be empty");
        }
    }

    /**
     * Parses {@code [http://]host[:port][/path]}.
     */
    public static ServiceAddress parse(String url) {
        String value = Objects.requireNonNull(url, "url");
        if (value.regionMatches(true, 0, HTTP_SCHEME, 0, HTTP_SCHEME.length())) {
            value = value.substring(HTTP_SCHEME.length());
        }
        int slash = value.indexOf('/');
        if (slash < 0) {
            return new ServiceAddress(value, "");
        }
        return new ServiceAddress(value.substring(0, slash), value.substring(slash + 1));
    }

    public String fullPath() {
        return hostPort + "/" + path;
    }

    /**
     * Path as it appears on the HTTP request line.
     */
    public String requestTarget() {
        return "/" + path;
    }

    public String host() {
        if (hostPort.startsWith("[")) {
            int close = hostPort.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 literal: " + hostPort);
            }
            return hostPort.substring(1, close);
        }
        int colon = hostPort.lastIndexOf(':');
        return colon < 0 ? hostPort : hostPort.substring(0, colon);
    }

    public int port() {
        int colon = hostPort.lastIndexOf(':');
        int close = hostPort.lastIndexOf(']');
        if (colon < 0 || colon < close) {
            return DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(hostPort.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in " + hostPort, e);
        }
    }

    @Override
    public String toString() {
        return fullPath();
    }

    private static String stripLeading(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }

    private static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
