package com.landregistry.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CancelApplicationRequest {

    @NotBlank(message = "Actor ID is required")
    private String actorId;
}
