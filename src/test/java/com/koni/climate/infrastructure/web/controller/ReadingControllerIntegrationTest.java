package com.koni.climate.infrastructure.web.controller;

import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.SourceKind;
import com.koni.climate.domain.repository.ReadingRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;

import static com.koni.climate.TestReadings.T0;
import static com.koni.climate.TestReadings.reading;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for ReadingController.
 * Seeds a temporary reading store directly and reads it back over HTTP.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ReadingControllerIntegrationTest {

    private static final Path WORK_DIR = createWorkDir();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("climate.storage.path", () -> WORK_DIR.resolve("readings.db").toString());
        registry.add("climate.registry.path", () -> WORK_DIR.resolve("device_registry.yaml").toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ReadingRepository readingRepository;

    @BeforeAll
    void seedStore() {
        readingRepository.insert(reading("motion-sensor:r1", T0.plusMinutes(2), "21.5")
                .humidityPercent(40.0).rawPayload("{\"state\":{}}").build());
        readingRepository.insert(reading("motion-sensor:r1", T0, "20.25").build());
        readingRepository.insert(reading("motion-sensor:r1", T0.plusMinutes(1), "45").anomalous(true).build());
        readingRepository.insert(thermostat(T0.plusMinutes(3)));
    }

    @Test
    void shouldReturnReadingsOrderedByTimestamp() throws Exception {
        mockMvc.perform(get("/api/v1/readings").param("deviceId", "motion-sensor:r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].timestamp").value("2026-10-19T08:00:00Z"))
                .andExpect(jsonPath("$[0].valueCelsius").value(20.25))
                .andExpect(jsonPath("$[1].anomalous").value(true))
                .andExpect(jsonPath("$[2].humidityPercent").value(40.0))
                .andExpect(jsonPath("$[2].sourceKind").value("motion-sensor"))
                .andExpect(jsonPath("$[2].rawPayload").doesNotExist())
                .andExpect(jsonPath("$[2].thermostatMode").value(nullValue()));
    }

    @Test
    void shouldFilterByWindowKindAndAnomalyFlag() throws Exception {
        mockMvc.perform(get("/api/v1/readings")
                        .param("from", "2026-10-19T08:01:00Z")
                        .param("to", "2026-10-19T08:03:00Z"))
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/v1/readings").param("sourceKind", "cloud-thermostat"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].thermostatMode").value("heating"));

        mockMvc.perform(get("/api/v1/readings").param("anomalousOnly", "true"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].valueCelsius").value(45.0));

        mockMvc.perform(get("/api/v1/readings").param("limit", "2"))
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void shouldRejectInvalidQueries() throws Exception {
        mockMvc.perform(get("/api/v1/readings").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/readings")
                        .param("from", "2026-10-19T09:00:00Z")
                        .param("to", "2026-10-19T08:00:00Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("from must be before to"));
        mockMvc.perform(get("/api/v1/readings").param("from", "yesterday"))
                .andExpect(status().isBadRequest());
    }

    private static Reading thermostat(OffsetDateTime timestamp) {
        return reading("cloud-thermostat:t1", timestamp, "19.5")
                .sourceKind(SourceKind.CLOUD_THERMOSTAT)
                .deviceName("Hall Thermostat")
                .thermostatMode("heating")
                .thermostatState("active")
                .build();
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("reading-controller-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
