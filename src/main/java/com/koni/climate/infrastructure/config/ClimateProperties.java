package com.koni.climate.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalized configuration bound from the {@code climate.*} namespace.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "climate")
public class ClimateProperties {

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Registry registry = new Registry();

    @Valid
    private Ingest ingest = new Ingest();

    @Getter
    @Setter
    public static class Storage {

        /** Location of the SQLite reading store. */
        @NotBlank
        private String path = "data/readings.db";

        /** How long a connection waits on a held write lock before reporting busy. */
        @NotNull
        private Duration busyTimeout = Duration.ofSeconds(5);

        /** Rows fetched per page by read-back queries. */
        @Min(1)
        private int pageSize = 500;
    }

    @Getter
    @Setter
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Registry {

        @NotBlank
        private String path = "config/device_registry.yaml";

        /** Devices silent for longer than this are reported as inactive. */
        @NotNull
        private Duration stalenessWindow = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Ingest {

        /** Keep a JSON snapshot of every vendor payload next to the reading. */
        private boolean storeRawPayload = false;
    }
}
