package com.example.obd2live.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "obd2")
@Data
@Validated
public class Obd2Properties {

    private final Buffer buffer = new Buffer();
    private final Live live = new Live();
    private final Intervals intervals = new Intervals();
    private final Consistency consistency = new Consistency();
    private final Sharing sharing = new Sharing();
    private final Analysis analysis = new Analysis();

    @Data
    public static class Buffer {
        @Positive
        private int batchSize = 10;
        @Positive
        private long flushIntervalMs = 5000L;
        @Positive
        private int flushThreads = 4;
        @NotNull
        private Duration forceFlushTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Live {
        @NotNull
        private Duration pollTimeout = Duration.ofSeconds(30);
        @Positive
        private int defaultPollLimit = 50;
        @Positive
        private int maxPollLimit = 1000;
        @Positive
        private int subscriberBufferSize = 256;
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        @NotNull
        private Duration cacheTtl = Duration.ofSeconds(300);
        @Positive
        private int maxCachedPoints = 1000;
    }

    @Data
    public static class Intervals {
        @NotEmpty
        private List<Duration> offsets = new ArrayList<>(List.of(
                Duration.ofSeconds(15),
                Duration.ofSeconds(60),
                Duration.ofSeconds(120),
                Duration.ofSeconds(180)));
        @Positive
        private int schedulerThreads = 4;
    }

    @Data
    public static class Consistency {
        @PositiveOrZero
        private int maxRetries = 5;
        @NotNull
        private Duration retryDelay = Duration.ofMillis(200);
    }

    @Data
    public static class Sharing {
        @Positive
        private int codeLength = 6;
        @NotNull
        private Duration expiry = Duration.ofHours(24);
        @NotNull
        private Duration clientTimeout = Duration.ofMinutes(2);
        @Positive
        private long cleanupIntervalMs = 60000L;
    }

    @Data
    public static class Analysis {
        @NotBlank
        private String engineUrl = "http://localhost:8001";
        @NotNull
        private Duration timeout = Duration.ofSeconds(120);
        @Positive
        private int threads = 4;
    }
}
