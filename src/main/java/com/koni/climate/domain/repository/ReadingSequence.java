package com.koni.climate.domain.repository;

import com.koni.climate.domain.model.Reading;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite and restartable sequence of readings.
 * Every call to {@link #iterator()} starts a fresh pass over the store.
 */
public interface ReadingSequence extends Iterable<Reading> {

    default Stream<Reading> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    default List<Reading> toList() {
        List<Reading> readings = new ArrayList<>();
        forEach(readings::add);
        return readings;
    }
}
