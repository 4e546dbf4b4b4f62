package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Builds the unpooled data source for the single-file reading store.
 *
 * Every {@code getConnection()} opens the file and every {@code close()} releases it,
 * so a crashed collector never keeps the store wedged for the others.
 * Connections are configured for write-ahead logging (readers never wait on a writer)
 * and IMMEDIATE transactions (a writer takes the write lock when it begins,
 * so lock waits happen up front under the busy timeout).
 */
@Slf4j
public final class SqliteDataSourceFactory {

    private SqliteDataSourceFactory() {
    }

    public static SQLiteDataSource create(Path databaseFile, Duration busyTimeout) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StorageException("Failed to create storage directory: " + parent, e);
            }
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout((int) busyTimeout.toMillis());
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());

        log.info("Reading store data source configured: file={}, busyTimeout={}ms",
                databaseFile.toAbsolutePath(), busyTimeout.toMillis());
        return dataSource;
    }
}
