package com.koni.climate.application.collector;

import com.koni.climate.domain.model.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Counts for one collection cycle of one source.
 */
@Getter
@AllArgsConstructor
public class CycleSummary {

    private final SourceKind sourceKind;
    private final int polled;
    private final int inserted;
    private final int duplicates;
    private final int rejected;
    private final int failed;

    /** The vendor could not be polled at all. */
    private final boolean pollFailed;

    /** The cycle stopped early because its thread was interrupted. */
    private final boolean interrupted;

    public int processed() {
        return inserted + duplicates + rejected + failed;
    }

    @Override
    public String toString() {
        return "CycleSummary{" +
                "sourceKind=" + sourceKind +
                ", polled=" + polled +
                ", inserted=" + inserted +
                ", duplicates=" + duplicates +
                ", rejected=" + rejected +
                ", failed=" + failed +
                ", pollFailed=" + pollFailed +
                ", interrupted=" + interrupted +
                '}';
    }
}
