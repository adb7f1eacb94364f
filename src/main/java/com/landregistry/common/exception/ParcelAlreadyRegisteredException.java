package com.landregistry.common.exception;

/**
 * Thrown when approving an application for a parcel that already has an approved application.
 */
public class ParcelAlreadyRegisteredException extends ConflictException {

    public ParcelAlreadyRegisteredException(String parcelId) {
        super("Parcel " + parcelId + " already has an approved application");
    }
}
