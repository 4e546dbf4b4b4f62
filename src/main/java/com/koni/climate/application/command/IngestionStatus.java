package com.koni.climate.application.command;

/**
 * Terminal state of one reading handed to the ingestion pipeline.
 */
public enum IngestionStatus {
    /** Committed to the store. */
    INSERTED,
    /** Same device and timestamp already stored; nothing written. */
    DUPLICATE,
    /** Payload malformed or invalid; nothing written. */
    REJECTED,
    /** Store failure, permanent or after retries were exhausted. */
    FAILED
}
