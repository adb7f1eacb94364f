package com.landregistry.common.exception;

/**
 * Thrown when an applicant already holds an open application on the same parcel.
 */
public class DuplicatePendingApplicationException extends ConflictException {

    private final String existingApplicationId;

    public DuplicatePendingApplicationException(String applicantId, String parcelId, String existingApplicationId) {
        super(String.format("Applicant %s already has an open application %s for parcel %s",
            applicantId, existingApplicationId, parcelId));
        this.existingApplicationId = existingApplicationId;
    }

    public String getExistingApplicationId() {
        return existingApplicationId;
    }
}
