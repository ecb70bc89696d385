package com.deepansh.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed gateway configuration, bound from application.yml under "gateway".
 */
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private Provider provider = new Provider();
    private Loop loop = new Loop();
    private Stream stream = new Stream();
    private Responses responses = new Responses();

    @Data
    public static class Provider {
        /** openai, ollama, zai or mistral */
        private String kind = "openai";
        private String apiKey = "";
        /** Empty means the kind's default base URL */
        private String baseUrl = "";
        private String model = "gpt-4o-mini";
        /** Applied when a request sets none; 0 leaves it to the backend */
        private int maxTokens = 0;
        /** Applied when a request sets none; 0 leaves it to the backend */
        private double temperature = 0;
        /** Ceiling for one loop turn, independent of the caller; 0 disables it */
        private Duration requestTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Loop {
        private int maxRounds = 20;
        private boolean stopOnFirstError = false;
    }

    @Data
    public static class Stream {
        private int bufferCapacity = 50;
    }

    @Data
    public static class Responses {
        private Duration sweepInterval = Duration.ofMinutes(1);
        private Duration retention = Duration.ofMinutes(15);
        private Duration pollInterval = Duration.ofMillis(100);
        private Duration waitTimeout = Duration.ofSeconds(30);
    }
}
