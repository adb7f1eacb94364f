package com.landregistry.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RevokeCertificateRequest {

    @NotBlank(message = "Actor ID is required")
    private String actorId;

    @NotBlank(message = "Revocation reason is required")
    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    private String reason;
}
