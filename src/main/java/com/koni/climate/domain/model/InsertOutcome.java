package com.koni.climate.domain.model;

/**
 * Terminal, non-failing outcomes of a store insert.
 * A permanent failure is signalled by an exception instead.
 */
public enum InsertOutcome {
    INSERTED,
    DUPLICATE_SKIPPED
}
