package dev.jsonrpc.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of a {@link dev.jsonrpc.client.transport.SocketRpcTransport}.
 */
public final class ClientOptions {

    public static final String DEFAULT_USER_AGENT = "jsonrpc_v2_client";

    private final String userAgent;
    private final Duration timeout;

    private ClientOptions(Builder builder) {
        this.userAgent = builder.userAgent;
        this.timeout = builder.timeout;
    }

    public static ClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String userAgent() {
        return userAgent;
    }

    /**
     * Bound applied to each of the connect, write and read phases. Empty means no bound.
     */
    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public String toString() {
        return "ClientOptions[userAgent=" + userAgent + ", timeout=" + timeout + "]";
    }

    public static final class Builder {

        private String userAgent = DEFAULT_USER_AGENT;
        private Duration timeout;

        private Builder() {
        }

        public Builder userAgent(String userAgent) {
            Objects.requireNonNull(userAgent, "userAgent");
            if (userAgent.isBlank() || userAgent.contains("\r") || userAgent.contains("\n")) {
                throw new IllegalArgumentException("Invalid user agent: " + userAgent);
            }
            this.userAgent = userAgent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
