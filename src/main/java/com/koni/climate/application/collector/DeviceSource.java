package com.koni.climate.application.collector;

import com.koni.climate.application.command.RecordReadingCommand;
import com.koni.climate.domain.model.SourceKind;

import java.io.IOException;
import java.util.List;

/**
 * Port to one vendor ecosystem. Implementations fetch the current state of every
 * device the vendor reports; authentication and transport are theirs.
 */
public interface DeviceSource {

    SourceKind kind();

    /**
     * Fetches one payload per device.
     *
     * @return the raw readings, possibly empty
     * @throws IOException if the vendor could not be reached; the poll is retried
     */
    List<RecordReadingCommand> poll() throws IOException;
}
