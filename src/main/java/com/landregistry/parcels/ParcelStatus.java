package com.landregistry.parcels;

/**
 * Registration status of a land parcel.
 */
public enum ParcelStatus {
    /**
     * No approved application exists for the parcel.
     */
    AVAILABLE,

    /**
     * The parcel has exactly one approved application and a certificate was issued for it.
     */
    REGISTERED,

    /**
     * Ownership is contested. Set by dispute processes outside this engine.
     */
    DISPUTED,

    /**
     * The parcel itself is being re-surveyed or re-adjudicated outside this engine.
     */
    UNDER_REVIEW
}
