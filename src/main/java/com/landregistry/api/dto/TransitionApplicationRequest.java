package com.landregistry.api.dto;

import com.landregistry.applications.ApplicationStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for moving an application to a new status. A reviewer is required for approval and rejection.
 */
@Data
public class TransitionApplicationRequest {

    @NotNull(message = "Target status is required")
    private ApplicationStatus status;

    @Size(max = 255, message = "Reviewer ID must be at most 255 characters")
    private String reviewerId;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
