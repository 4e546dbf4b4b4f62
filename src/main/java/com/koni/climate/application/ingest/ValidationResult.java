package com.koni.climate.application.ingest;

import com.koni.climate.domain.model.Reading;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of validating one reading: the (possibly corrected) reading plus
 * the secondary field violations that were cleared from it.
 */
@Getter
@AllArgsConstructor
public class ValidationResult {

    private final Reading reading;
    private final List<String> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
