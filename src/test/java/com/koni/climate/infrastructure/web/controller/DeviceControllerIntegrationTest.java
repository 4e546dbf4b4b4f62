package com.koni.climate.infrastructure.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.climate.application.command.IngestionResult;
import com.koni.climate.application.command.IngestionStatus;
import com.koni.climate.application.command.RecordReadingCommand;
import com.koni.climate.application.command.RecordReadingCommandHandler;
import com.koni.climate.domain.model.DeviceMetadata;
import com.koni.climate.domain.model.SourceKind;
import com.koni.climate.infrastructure.web.dto.RenameDeviceRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for DeviceController.
 * Runs the full application against a temporary reading store and registry file.
 *
 * Tests:
 * - GET /api/v1/devices after ingestion, with and without a source kind filter
 * - PUT /api/v1/devices/{deviceId}/name, plain and recursive
 * - 400 and 404 error responses
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DeviceControllerIntegrationTest {

    private static final Path WORK_DIR = createWorkDir();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("climate.storage.path", () -> WORK_DIR.resolve("readings.db").toString());
        registry.add("climate.registry.path", () -> WORK_DIR.resolve("device_registry.yaml").toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RecordReadingCommandHandler commandHandler;

    @Test
    void shouldListDevicesRegisteredByIngestion() throws Exception {
        // Given
        ingestMotionReading("list-1", "Kitchen", 2150);
        ingestThermostatReading("list-2", "Kitchen");

        // When
        MvcResult result = mockMvc.perform(get("/api/v1/devices").param("sourceKind", "motion-sensor"))
                .andExpect(status().isOk())
                .andReturn();

        // Then
        JsonNode devices = objectMapper.readTree(result.getResponse().getContentAsString());
        JsonNode device = find(devices, "motion-sensor:list-1");
        assertThat(device).isNotNull();
        assertThat(device.get("name").asText()).isEqualTo("Kitchen Motion Sensor");
        assertThat(device.get("location").asText()).isEqualTo("Kitchen");
        assertThat(device.get("sourceKind").asText()).isEqualTo("motion-sensor");
        assertThat(device.get("active").asBoolean()).isTrue();
        assertThat(find(devices, "cloud-thermostat:list-2")).isNull();
    }

    @Test
    void shouldRenameRecursivelyAndRewriteStoredReadings() throws Exception {
        // Given
        ingestMotionReading("rename-1", "Hall", 2000);
        Thread.sleep(5);
        ingestMotionReading("rename-1", "Hall", 2010);
        ingestMotionReading("rename-2", "Hall", 2020);

        // When
        mockMvc.perform(put("/api/v1/devices/{deviceId}/name", "motion-sensor:rename-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RenameDeviceRequest("Front Door Sensor", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previousName").value("Hall Motion Sensor"))
                .andExpect(jsonPath("$.name").value("Front Door Sensor"))
                .andExpect(jsonPath("$.recursive").value(true))
                .andExpect(jsonPath("$.readingsUpdated").value(2));

        // Then
        mockMvc.perform(get("/api/v1/readings").param("deviceId", "motion-sensor:rename-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].deviceName").value("Front Door Sensor"))
                .andExpect(jsonPath("$[1].deviceName").value("Front Door Sensor"));
        mockMvc.perform(get("/api/v1/readings").param("deviceId", "motion-sensor:rename-2"))
                .andExpect(jsonPath("$[0].deviceName").value("Hall Motion Sensor"));

        // New readings pick up the registry name
        Thread.sleep(5);
        IngestionResult next = ingestMotionReading("rename-1", "Hall", 2030);
        assertThat(next.getReading().getDeviceName()).isEqualTo("Front Door Sensor");
    }

    @Test
    void shouldRenameRegistryOnlyWhenNotRecursive() throws Exception {
        // Given
        ingestMotionReading("plain-1", "Study", 1990);

        // When
        mockMvc.perform(put("/api/v1/devices/{deviceId}/name", "motion-sensor:plain-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Desk Sensor\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.readingsUpdated").value(0));

        // Then
        mockMvc.perform(get("/api/v1/readings").param("deviceId", "motion-sensor:plain-1"))
                .andExpect(jsonPath("$[0].deviceName").value("Study Motion Sensor"));
    }

    @Test
    void shouldReturn404ForUnknownDevice() throws Exception {
        mockMvc.perform(put("/api/v1/devices/{deviceId}/name", "motion-sensor:missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Anything\",\"recursive\":true}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.message").value("Device not found: motion-sensor:missing"));
    }

    @Test
    void shouldReturn400ForBlankNameOrUnknownSourceKind() throws Exception {
        mockMvc.perform(put("/api/v1/devices/{deviceId}/name", "motion-sensor:any")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("name is required"));

        mockMvc.perform(get("/api/v1/devices").param("sourceKind", "smart-fridge"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown source kind: smart-fridge"));
    }

    private IngestionResult ingestMotionReading(String vendorId, String location, int hundredths) throws Exception {
        JsonNode payload = objectMapper.readTree(
                "{\"state\":{\"temperature\":" + hundredths + "},\"config\":{\"battery\":90,\"reachable\":true}}");
        IngestionResult result = commandHandler.handle(new RecordReadingCommand(SourceKind.MOTION_SENSOR, payload,
                DeviceMetadata.builder().vendorUniqueId(vendorId).location(location).build()));
        assertThat(result.getStatus()).isEqualTo(IngestionStatus.INSERTED);
        return result;
    }

    private void ingestThermostatReading(String vendorId, String location) throws Exception {
        JsonNode payload = objectMapper.readTree(
                "{\"temperature\":{\"value\":68.0,\"scale\":\"FAHRENHEIT\"},\"mode\":\"HEAT\"}");
        IngestionResult result = commandHandler.handle(new RecordReadingCommand(SourceKind.CLOUD_THERMOSTAT, payload,
                DeviceMetadata.builder().vendorUniqueId(vendorId).location(location).build()));
        assertThat(result.getStatus()).isEqualTo(IngestionStatus.INSERTED);
    }

    private static JsonNode find(JsonNode devices, String deviceId) {
        for (JsonNode device : devices) {
            if (deviceId.equals(device.get("deviceId").asText())) {
                return device;
            }
        }
        return null;
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("device-controller-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
