package com.koni.climate.infrastructure.config;

import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.domain.repository.ReadingRepository;
import com.koni.climate.infrastructure.persistence.SchemaMigrator;
import com.koni.climate.infrastructure.persistence.SqliteDataSourceFactory;
import com.koni.climate.infrastructure.persistence.SqliteReadingRepository;
import com.koni.climate.infrastructure.registry.YamlDeviceRegistry;
import com.koni.climate.infrastructure.resilience.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the reading store and the device registry from {@code climate.*} properties.
 * The schema is migrated before the repository bean exists, so a store that cannot
 * be migrated stops the application from starting.
 */
@Configuration
@EnableConfigurationProperties(ClimateProperties.class)
public class StorageConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DataSource readingStoreDataSource(ClimateProperties properties) {
        ClimateProperties.Storage storage = properties.getStorage();
        return SqliteDataSourceFactory.create(Path.of(storage.getPath()), storage.getBusyTimeout());
    }

    @Bean
    public SchemaMigrator schemaMigrator(DataSource readingStoreDataSource, RetryPolicy retryPolicy) {
        SchemaMigrator migrator = new SchemaMigrator(readingStoreDataSource, retryPolicy);
        migrator.migrate();
        return migrator;
    }

    @Bean
    public ReadingRepository readingRepository(DataSource readingStoreDataSource, RetryPolicy retryPolicy,
                                               SchemaMigrator schemaMigrator, ClimateProperties properties) {
        return new SqliteReadingRepository(readingStoreDataSource, retryPolicy, properties.getStorage().getPageSize());
    }

    @Bean
    public DeviceRegistry deviceRegistry(ClimateProperties properties, RetryPolicy retryPolicy, Clock clock) {
        return new YamlDeviceRegistry(Path.of(properties.getRegistry().getPath()), retryPolicy, clock);
    }
}
