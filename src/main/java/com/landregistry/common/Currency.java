package com.landregistry.common;

/**
 * Currencies accepted for registry fees.
 * Each currency carries the number of minor-unit digits amounts are rounded to.
 */
public enum Currency {
    XAF(0),  // Central African CFA franc, no minor unit in circulation
    USD(2),
    EUR(2);

    private final int minorUnits;

    Currency(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    public int getMinorUnits() {
        return minorUnits;
    }
}
