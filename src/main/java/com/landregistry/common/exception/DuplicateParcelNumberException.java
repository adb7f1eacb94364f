package com.landregistry.common.exception;

/**
 * Thrown when a parcel number is already in the registry.
 */
public class DuplicateParcelNumberException extends ConflictException {

    public DuplicateParcelNumberException(String parcelNumber) {
        super("Land parcel number already exists: " + parcelNumber);
    }
}
