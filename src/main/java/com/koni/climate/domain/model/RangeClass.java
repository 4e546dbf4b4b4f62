package com.koni.climate.domain.model;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Plausible temperature band for a class of sources, in degrees Celsius.
 * Both bounds are inclusive.
 */
@Getter
public enum RangeClass {

    INDOOR(new BigDecimal("0"), new BigDecimal("40")),
    OUTDOOR(new BigDecimal("-40"), new BigDecimal("50"));

    private final BigDecimal minCelsius;
    private final BigDecimal maxCelsius;

    RangeClass(BigDecimal minCelsius, BigDecimal maxCelsius) {
        this.minCelsius = minCelsius;
        this.maxCelsius = maxCelsius;
    }

    public boolean contains(BigDecimal celsius) {
        return celsius.compareTo(minCelsius) >= 0 && celsius.compareTo(maxCelsius) <= 0;
    }
}
