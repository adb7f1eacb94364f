package com.landregistry.common.exception;

/**
 * Thrown when a land parcel is not found.
 */
public class ParcelNotFoundException extends NotFoundException {

    public ParcelNotFoundException(String parcelRef) {
        super("Parcel", parcelRef);
    }
}
