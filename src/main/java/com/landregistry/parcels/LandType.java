package com.landregistry.parcels;

/**
 * Land-use category of a parcel. Drives the land-type fee multiplier.
 */
public enum LandType {
    RESIDENTIAL,
    COMMERCIAL,
    AGRICULTURAL,
    INDUSTRIAL
}
