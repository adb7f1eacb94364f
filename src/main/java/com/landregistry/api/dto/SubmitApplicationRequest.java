package com.landregistry.api.dto;

import com.landregistry.applications.ApplicationType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for submitting an application against a parcel.
 */
@Data
public class SubmitApplicationRequest {

    @NotBlank(message = "Applicant ID is required")
    @Size(max = 255, message = "Applicant ID must be at most 255 characters")
    private String applicantId;

    @NotBlank(message = "Parcel ID is required")
    private String parcelId;

    @NotNull(message = "Application type is required")
    private ApplicationType applicationType;

    @Min(value = 1, message = "Priority level must be between 1 and 5")
    @Max(value = 5, message = "Priority level must be between 1 and 5")
    private Integer priorityLevel;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
