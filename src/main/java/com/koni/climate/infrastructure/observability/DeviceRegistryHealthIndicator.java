package com.koni.climate.infrastructure.observability;

import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.infrastructure.config.ClimateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Health indicator for the device registry.
 *
 * UP when the registry file can be read, with the number of registered devices and
 * the ids of those that have not reported within the staleness window.
 * Stale devices do not make the registry DOWN; they point at a collector or a device problem.
 */
@Slf4j
@Component
public class DeviceRegistryHealthIndicator implements HealthIndicator {

    private final DeviceRegistry deviceRegistry;
    private final Clock clock;
    private final Duration stalenessWindow;

    public DeviceRegistryHealthIndicator(DeviceRegistry deviceRegistry, Clock clock, ClimateProperties properties) {
        this.deviceRegistry = deviceRegistry;
        this.clock = clock;
        this.stalenessWindow = properties.getRegistry().getStalenessWindow();
    }

    @Override
    public Health health() {
        try {
            List<RegistryEntry> devices = deviceRegistry.list(null);
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<String> stale = devices.stream()
                    .filter(entry -> !entry.isActive(now, stalenessWindow))
                    .map(RegistryEntry::getDeviceId)
                    .collect(Collectors.toList());

            if (!stale.isEmpty()) {
                log.warn("{} of {} devices have not reported within {}", stale.size(), devices.size(), stalenessWindow);
            }
            return Health.up()
                    .withDetail("registered", devices.size())
                    .withDetail("active", devices.size() - stale.size())
                    .withDetail("stale", stale)
                    .withDetail("stalenessWindow", stalenessWindow.toString())
                    .build();

        } catch (Exception e) {
            log.error("Device registry health check failed", e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
