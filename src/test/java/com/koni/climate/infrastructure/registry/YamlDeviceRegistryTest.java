package com.koni.climate.infrastructure.registry;

import com.koni.climate.domain.exception.DeviceNotFoundException;
import com.koni.climate.domain.exception.DeviceRegistryException;
import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.model.SourceKind;
import com.koni.climate.infrastructure.resilience.RetryPolicy;
import com.koni.climate.infrastructure.resilience.RetrySettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for YamlDeviceRegistry against a real registry file.
 */
class YamlDeviceRegistryTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    @TempDir
    Path tempDir;

    private Path registryFile;
    private MutableClock clock;
    private RetryPolicy retryPolicy;
    private YamlDeviceRegistry registry;

    @BeforeEach
    void setUp() {
        registryFile = tempDir.resolve("config").resolve("device_registry.yaml");
        clock = new MutableClock(NOW);
        retryPolicy = new RetryPolicy(new RetrySettings(50, Duration.ofMillis(2), Duration.ofMillis(20)));
        registry = new YamlDeviceRegistry(registryFile, retryPolicy, clock);
    }

    @Test
    void shouldCreateRegistryFileWithCommentHeader() throws Exception {
        assertThat(registryFile).exists();
        assertThat(Files.readString(registryFile)).contains("_comment").contains("devices");
        assertThat(registry.list(null)).isEmpty();
    }

    @Test
    void shouldRegisterUnseenDeviceWithInferredName() {
        // When
        RegistryEntry entry = registry.resolveOrRegister("motion-sensor:abc", "Hall Motion Sensor", "Hall",
                SourceKind.MOTION_SENSOR, "SML001");

        // Then
        assertThat(entry.getName()).isEqualTo("Hall Motion Sensor");
        assertThat(entry.getLocation()).isEqualTo("Hall");
        assertThat(entry.getSourceKind()).isEqualTo(SourceKind.MOTION_SENSOR);
        assertThat(entry.getModelInfo()).isEqualTo("SML001");
        assertThat(entry.getFirstSeen()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(entry.getLastSeen()).isEqualTo(entry.getFirstSeen());
        assertThat(registry.findById("motion-sensor:abc")).isPresent();
    }

    @Test
    void shouldOnlyUpdateLastSeenOnSecondSighting() {
        // Given
        registry.resolveOrRegister("motion-sensor:abc", "Hall Motion Sensor", "Hall", SourceKind.MOTION_SENSOR, null);
        clock.advance(Duration.ofMinutes(5));

        // When
        RegistryEntry entry = registry.resolveOrRegister("motion-sensor:abc", "Something Else", "Hall",
                SourceKind.MOTION_SENSOR, null);

        // Then
        assertThat(registry.list(null)).hasSize(1);
        assertThat(entry.getName()).isEqualTo("Hall Motion Sensor");
        assertThat(entry.getFirstSeen()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(entry.getLastSeen()).isEqualTo(OffsetDateTime.ofInstant(NOW.plusSeconds(300), ZoneOffset.UTC));
    }

    @Test
    void shouldReinferAutomaticNameWhenLocationChanges() {
        // Given
        registry.resolveOrRegister("cloud-thermostat:t1", "Thermostat", "", SourceKind.CLOUD_THERMOSTAT, null);

        // When
        RegistryEntry entry = registry.resolveOrRegister("cloud-thermostat:t1", "Living Room Thermostat",
                "Living Room", SourceKind.CLOUD_THERMOSTAT, null);

        // Then
        assertThat(entry.getLocation()).isEqualTo("Living Room");
        assertThat(entry.getName()).isEqualTo("Living Room Thermostat");
    }

    @Test
    void shouldKeepCustomNameWhenLocationChanges() {
        // Given
        registry.resolveOrRegister("cloud-thermostat:t1", "Thermostat", "", SourceKind.CLOUD_THERMOSTAT, null);
        registry.setName("cloud-thermostat:t1", "Main Thermostat");

        // When
        RegistryEntry entry = registry.resolveOrRegister("cloud-thermostat:t1", "Living Room Thermostat",
                "Living Room", SourceKind.CLOUD_THERMOSTAT, null);

        // Then
        assertThat(entry.getName()).isEqualTo("Main Thermostat");
        assertThat(entry.getLocation()).isEqualTo("Living Room");
    }

    @Test
    void shouldRenameIdempotentlyWithoutTouchingLastSeen() {
        // Given
        registry.resolveOrRegister("motion-sensor:abc", "Hall Motion Sensor", "Hall", SourceKind.MOTION_SENSOR, null);
        clock.advance(Duration.ofHours(1));

        // When
        registry.setName("motion-sensor:abc", "Front Door Sensor");
        RegistryEntry entry = registry.setName("motion-sensor:abc", "Front Door Sensor");

        // Then
        assertThat(entry.getName()).isEqualTo("Front Door Sensor");
        assertThat(entry.getLastSeen()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(registry.findById("motion-sensor:abc")).get()
                .extracting(RegistryEntry::getName).isEqualTo("Front Door Sensor");
    }

    @Test
    void shouldRejectRenameOfUnknownDevice() {
        assertThatThrownBy(() -> registry.setName("motion-sensor:missing", "Name"))
                .isInstanceOf(DeviceNotFoundException.class)
                .hasMessageContaining("motion-sensor:missing");
    }

    @Test
    void shouldListDevicesSortedAndFilteredByKind() {
        // Given
        registry.resolveOrRegister("motion-sensor:b", "B", "Hall", SourceKind.MOTION_SENSOR, null);
        registry.resolveOrRegister("cloud-thermostat:t1", "T", "Hall", SourceKind.CLOUD_THERMOSTAT, null);
        registry.resolveOrRegister("motion-sensor:a", "A", "Hall", SourceKind.MOTION_SENSOR, null);

        // When / Then
        assertThat(registry.list(null)).extracting(RegistryEntry::getDeviceId)
                .containsExactly("cloud-thermostat:t1", "motion-sensor:a", "motion-sensor:b");
        assertThat(registry.list(SourceKind.MOTION_SENSOR)).extracting(RegistryEntry::getDeviceId)
                .containsExactly("motion-sensor:a", "motion-sensor:b");
    }

    @Test
    void shouldPickUpOperatorEditsAndKeepUnknownTopLevelKeys() throws Exception {
        // Given
        registry.resolveOrRegister("motion-sensor:abc", "Hall Motion Sensor", "Hall", SourceKind.MOTION_SENSOR, null);
        String edited = Files.readString(registryFile).replace("name: Hall Motion Sensor", "name: Landing Sensor")
                + "notes: kept by the operator\n";
        Files.writeString(registryFile, edited);

        // When
        RegistryEntry entry = registry.findById("motion-sensor:abc").orElseThrow();
        registry.resolveOrRegister("motion-sensor:new", "Kitchen Motion Sensor", "Kitchen",
                SourceKind.MOTION_SENSOR, null);

        // Then
        assertThat(entry.getName()).isEqualTo("Landing Sensor");
        assertThat(registry.extras()).containsEntry("notes", "kept by the operator").containsKey("_comment");
        assertThat(registry.findById("motion-sensor:abc").orElseThrow().getName()).isEqualTo("Landing Sensor");
    }

    @Test
    void shouldReportUnreadableRegistryAsRegistryError() throws Exception {
        // Given
        Files.writeString(registryFile, "devices: [this is: not: valid");

        // When / Then
        assertThatThrownBy(() -> registry.findById("motion-sensor:abc"))
                .isInstanceOf(DeviceRegistryException.class);
    }

    @Test
    void shouldReadHandEditedTimestampsAndSkipUnknownSourceKind() throws Exception {
        // Given
        Files.writeString(registryFile, String.join("\n",
                "devices:",
                "  motion-sensor:abc:",
                "    name: Hall Motion Sensor",
                "    location: Hall",
                "    source_kind: motion-sensor",
                "    first_seen: \"2025-11-20 10:00:00\"",
                "    last_seen: 2025-11-21T09:30:00",
                "  motion-sensor:def:",
                "    name: Porch Sensor",
                "    location: Porch",
                "    source_kind: smart-fridge",
                "    first_seen: 2025-11-20T10:00:00+02:00",
                "    last_seen: last tuesday",
                ""));

        // When
        RegistryEntry abc = registry.findById("motion-sensor:abc").orElseThrow();
        RegistryEntry def = registry.findById("motion-sensor:def").orElseThrow();
        RegistryEntry added = registry.resolveOrRegister("motion-sensor:new", "Kitchen Motion Sensor", "Kitchen",
                SourceKind.MOTION_SENSOR, null);

        // Then
        assertThat(abc.getFirstSeen()).isEqualTo(OffsetDateTime.parse("2025-11-20T10:00:00Z"));
        assertThat(abc.getLastSeen()).isEqualTo(OffsetDateTime.parse("2025-11-21T09:30:00Z"));
        assertThat(abc.getSourceKind()).isEqualTo(SourceKind.MOTION_SENSOR);
        assertThat(def.getName()).isEqualTo("Porch Sensor");
        assertThat(def.getSourceKind()).isNull();
        assertThat(def.getFirstSeen()).isEqualTo(OffsetDateTime.parse("2025-11-20T08:00:00Z"));
        assertThat(def.getLastSeen()).isNull();
        assertThat(added.getName()).isEqualTo("Kitchen Motion Sensor");
        assertThat(registry.list(null)).extracting(RegistryEntry::getDeviceId)
                .containsExactly("motion-sensor:abc", "motion-sensor:def", "motion-sensor:new");
        assertThat(registry.list(SourceKind.MOTION_SENSOR)).extracting(RegistryEntry::getDeviceId)
                .containsExactly("motion-sensor:abc", "motion-sensor:new");
    }

    @Test
    void shouldRestoreDroppedSourceKindOnNextSighting() throws Exception {
        // Given
        Files.writeString(registryFile, String.join("\n",
                "devices:",
                "  motion-sensor:def:",
                "    name: Porch Sensor",
                "    location: Porch",
                "    source_kind: motion-sensr",
                ""));

        // When
        RegistryEntry entry = registry.resolveOrRegister("motion-sensor:def", "Porch Motion Sensor", "Porch",
                SourceKind.MOTION_SENSOR, null);

        // Then
        assertThat(entry.getSourceKind()).isEqualTo(SourceKind.MOTION_SENSOR);
        assertThat(entry.getName()).isEqualTo("Porch Sensor");
        assertThat(Files.readString(registryFile)).contains("source_kind: motion-sensor\n");
    }

    @Test
    void shouldRegisterEveryDeviceWhenSeveralRegistriesShareTheFile() throws Exception {
        // Given - independent registry instances stand in for separate collector processes
        int collectors = 4;
        int devicesPerCollector = 10;
        ExecutorService executor = Executors.newFixedThreadPool(collectors);
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int c = 0; c < collectors; c++) {
            int collector = c;
            tasks.add(() -> {
                YamlDeviceRegistry own = new YamlDeviceRegistry(registryFile, retryPolicy, clock);
                for (int d = 0; d < devicesPerCollector; d++) {
                    own.resolveOrRegister("motion-sensor:c" + collector + "-d" + d, "Sensor " + d, "Room " + collector,
                            SourceKind.MOTION_SENSOR, null);
                }
                return null;
            });
        }

        // When
        List<Future<Void>> futures;
        try {
            futures = executor.invokeAll(tasks, 60, TimeUnit.SECONDS);
        } finally {
            executor.shutdown();
        }

        // Then
        for (Future<Void> future : futures) {
            future.get();
        }
        assertThat(registry.list(null)).hasSize(collectors * devicesPerCollector);
    }

    @Test
    void shouldResolveConcurrentFirstSightingsOfOneDeviceToOneEntry() throws Exception {
        // Given
        int callers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        List<Callable<RegistryEntry>> tasks = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            String candidate = "Candidate " + i;
            tasks.add(() -> new YamlDeviceRegistry(registryFile, retryPolicy, clock)
                    .resolveOrRegister("motion-sensor:shared", candidate, "Hall", SourceKind.MOTION_SENSOR, null));
        }

        // When
        List<Future<RegistryEntry>> futures;
        try {
            futures = executor.invokeAll(tasks, 60, TimeUnit.SECONDS);
        } finally {
            executor.shutdown();
        }

        // Then
        List<String> names = new ArrayList<>();
        for (Future<RegistryEntry> future : futures) {
            names.add(future.get().getName());
        }
        assertThat(registry.list(null)).hasSize(1);
        assertThat(names).containsOnly(registry.findById("motion-sensor:shared").orElseThrow().getName());
    }

    /**
     * Clock whose instant tests move forward explicitly.
     */
    private static final class MutableClock extends Clock {

        private volatile Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
