package com.koni.climate.infrastructure.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.koni.climate.domain.exception.DeviceNotFoundException;
import com.koni.climate.domain.exception.DeviceRegistryException;
import com.koni.climate.domain.exception.RegistryBusyException;
import com.koni.climate.domain.model.DeviceNames;
import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.model.SourceKind;
import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.infrastructure.resilience.ErrorClassifier;
import com.koni.climate.infrastructure.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Device registry kept in a human-editable YAML file.
 *
 * <p>Mutations are read-modify-write cycles under an exclusive lock on a sidecar
 * {@code <file>.lock}, shared by every collector process on the host. The new
 * content is written to a temporary file and moved over the registry atomically,
 * so readers never take the lock and never see a half-written file.</p>
 *
 * <p>A lock held elsewhere raises {@link RegistryBusyException}, which the
 * {@link RetryPolicy} treats as transient.</p>
 */
@Slf4j
public class YamlDeviceRegistry implements DeviceRegistry {

    private final Path registryFile;
    private final Path lockFile;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Object monitor = new Object();

    public YamlDeviceRegistry(Path registryFile, RetryPolicy retryPolicy, Clock clock) {
        this.registryFile = registryFile.toAbsolutePath();
        this.lockFile = this.registryFile.resolveSibling(this.registryFile.getFileName() + ".lock");
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.mapper = createMapper();
        initialize();
    }

    static ObjectMapper createMapper() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                .build();
        return new ObjectMapper(factory)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private void initialize() {
        if (Files.exists(registryFile)) {
            return;
        }
        try {
            Files.createDirectories(registryFile.getParent());
        } catch (IOException e) {
            throw new DeviceRegistryException("Failed to create registry directory: " + registryFile.getParent(), e);
        }
        mutate("create registry", document -> {
            if (document.getDevices().isEmpty() && !document.getExtras().containsKey(RegistryDocument.COMMENT_KEY)) {
                document.putExtra(RegistryDocument.COMMENT_KEY, RegistryDocument.DEFAULT_COMMENT);
            }
            return null;
        });
        log.info("Created device registry at {}", registryFile);
    }

    @Override
    public Optional<RegistryEntry> findById(String deviceId) {
        RegistryRecord record = load().getDevices().get(deviceId);
        return Optional.ofNullable(record).map(r -> r.toEntry(deviceId));
    }

    @Override
    public RegistryEntry resolveOrRegister(String deviceId, String inferredName, String location,
                                           SourceKind sourceKind, String modelInfo) {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        return mutate("register device " + deviceId, document -> {
            OffsetDateTime now = now();
            RegistryRecord record = document.getDevices().get(deviceId);
            if (record == null) {
                record = new RegistryRecord();
                record.setName(inferredName);
                record.setLocation(location);
                record.setSourceKind(sourceKind);
                record.setModelInfo(modelInfo);
                record.setFirstSeen(now);
                record.setLastSeen(now);
                document.getDevices().put(deviceId, record);
                log.info("Registered new device: deviceId={}, name='{}'", deviceId, inferredName);
                return record.toEntry(deviceId);
            }

            record.setLastSeen(now);
            if (record.getSourceKind() == null) {
                record.setSourceKind(sourceKind);
            }
            if (modelInfo != null && record.getModelInfo() == null) {
                record.setModelInfo(modelInfo);
            }
            if (location != null && !location.isBlank() && !location.equals(record.getLocation())) {
                refreshLocation(deviceId, record, location, sourceKind);
            }
            return record.toEntry(deviceId);
        });
    }

    private void refreshLocation(String deviceId, RegistryRecord record, String location, SourceKind sourceKind) {
        SourceKind kind = record.getSourceKind() != null ? record.getSourceKind() : sourceKind;
        String previouslyInferred = DeviceNames.infer(record.getLocation(), kind);
        String oldLocation = record.getLocation();
        record.setLocation(location);
        // only names nobody edited follow the location
        if (previouslyInferred.equals(record.getName())) {
            record.setName(DeviceNames.infer(location, kind));
        }
        log.info("Device moved: deviceId={}, location '{}' -> '{}', name='{}'",
                deviceId, oldLocation, location, record.getName());
    }

    @Override
    public RegistryEntry setName(String deviceId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Device name cannot be blank");
        }
        return mutate("rename device " + deviceId, document -> {
            RegistryRecord record = document.getDevices().get(deviceId);
            if (record == null) {
                throw new DeviceNotFoundException("Device not found: " + deviceId);
            }
            String oldName = record.getName();
            record.setName(name.trim());
            log.info("Updated device name: deviceId={}, '{}' -> '{}'", deviceId, oldName, record.getName());
            return record.toEntry(deviceId);
        });
    }

    @Override
    public List<RegistryEntry> list(SourceKind sourceKind) {
        return load().getDevices().entrySet().stream()
                .filter(e -> sourceKind == null || sourceKind == e.getValue().getSourceKind())
                .map(e -> e.getValue().toEntry(e.getKey()))
                .collect(Collectors.toList());
    }

    public Path getRegistryFile() {
        return registryFile;
    }

    private <T> T mutate(String operation, Function<RegistryDocument, T> change) {
        return retryPolicy.execute(operation, () -> mutateOnce(change), ErrorClassifier.registry());
    }

    private <T> T mutateOnce(Function<RegistryDocument, T> change) {
        synchronized (monitor) {
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                FileLock lock = tryLock(channel);
                if (lock == null) {
                    throw new RegistryBusyException("Registry lock is held by another process: " + lockFile);
                }
                try (lock) {
                    RegistryDocument document = load();
                    T result = change.apply(document);
                    save(document);
                    return result;
                }
            } catch (IOException e) {
                throw new DeviceRegistryException("Failed to update registry " + registryFile, e);
            }
        }
    }

    private FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            throw new RegistryBusyException("Registry lock is held within this process: " + lockFile, e);
        }
    }

    private RegistryDocument load() {
        if (!Files.exists(registryFile)) {
            return new RegistryDocument();
        }
        try {
            RegistryDocument document = mapper.readValue(registryFile.toFile(), RegistryDocument.class);
            return document == null ? new RegistryDocument() : document;
        } catch (IOException e) {
            throw new DeviceRegistryException("Failed to read registry " + registryFile + ": " + e.getMessage(), e);
        }
    }

    private void save(RegistryDocument document) throws IOException {
        Path temp = Files.createTempFile(registryFile.getParent(), registryFile.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), document);
            Files.move(temp, registryFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    Map<String, Object> extras() {
        return load().getExtras();
    }
}
