package dev.jsonrpc.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jsonrpc.server.config.TransportProperties;
import dev.jsonrpc.server.service.MathService;
import dev.jsonrpc.server.transport.HttpRpcServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(TransportProperties.class)
public class MathServiceApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(MathServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MathServiceApplication.class, args);
    }

    @Bean
    MathService mathService() {
        return new MathService(new ObjectMapper());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    HttpRpcServer httpRpcServer(TransportProperties transportProperties, MathService mathService) {
        LOGGER.info("Math service path: /{} (api key {})", transportProperties.getPath(),
            transportProperties.apiKey().isPresent() ? "required" : "not required");
        return new HttpRpcServer(transportProperties.getPort(), transportProperties.getPath(),
            transportProperties.apiKey(), mathService);
    }
}
