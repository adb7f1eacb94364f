package com.landregistry.applications;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to open an application against a parcel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitApplicationCommand {

    private String applicantId;

    private String parcelId;

    private ApplicationType applicationType;

    /**
     * Priority level 1 (normal) to 5 (critical). Defaults to 1.
     */
    private Integer priorityLevel;

    private String notes;
}
