package dev.jsonrpc.server.config;

import dev.jsonrpc.transport.Credential;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "transport.http")
public class TransportProperties {

    private int port = 8082;

    /**
     * Request path the service answers on, without leading slash.
     */
    private String path = "math-api";

    /**
     * Header name of the API key. When both name and value are set, requests must carry it.
     */
    private String apiKeyName;

    private String apiKeyValue;

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getApiKeyName() {
        return apiKeyName;
    }

    public void setApiKeyName(String apiKeyName) {
        this.apiKeyName = apiKeyName;
    }

    public String getApiKeyValue() {
        return apiKeyValue;
    }

    public void setApiKeyValue(String apiKeyValue) {
        this.apiKeyValue = apiKeyValue;
    }

    public Optional<Credential> apiKey() {
        if (apiKeyName == null || apiKeyName.isBlank() || apiKeyValue == null) {
            return Optional.empty();
        }
        return Optional.of(new Credential(apiKeyName, apiKeyValue));
    }
}
