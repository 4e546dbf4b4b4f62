package com.koni.climate.domain.repository;

import com.koni.climate.domain.model.InsertOutcome;
import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.ReadingQuery;

/**
 * Repository interface for the reading store.
 * This interface is part of the domain layer and defines the contract
 * for reading persistence without coupling to the embedded engine behind it.
 *
 * Implementations must tolerate several independent processes writing
 * to the same store at once.
 */
public interface ReadingRepository {

    /**
     * Commits a reading in its own transaction.
     * A second insert with the same (deviceId, timestamp) is a no-op.
     *
     * @param reading the validated reading to store
     * @return {@link InsertOutcome#INSERTED} or {@link InsertOutcome#DUPLICATE_SKIPPED}
     * @throws com.koni.climate.domain.exception.StoreBusyException if the store stayed locked for every attempt
     * @throws com.koni.climate.domain.exception.StorageException on any permanent failure
     */
    InsertOutcome insert(Reading reading);

    /**
     * Returns the readings matching the query, ordered by timestamp.
     * The sequence is lazy and can be iterated any number of times; each
     * iteration re-reads the store.
     *
     * @param query the filters to apply
     * @return a restartable sequence of readings
     */
    ReadingSequence query(ReadingQuery query);

    /**
     * Counts readings matching the query, ignoring its limit.
     *
     * @param query the filters to apply
     * @return number of matching readings
     */
    long count(ReadingQuery query);

    /**
     * Rewrites the display fields of every stored reading of one device.
     * This is the only mutation of committed readings and runs as a single
     * all-or-nothing update.
     *
     * @param deviceId the device whose history is rewritten
     * @param deviceName the new display name
     * @param location the new location, or null to keep each row's location
     * @return the number of rows updated
     */
    int rewriteDisplayFields(String deviceId, String deviceName, String location);
}
