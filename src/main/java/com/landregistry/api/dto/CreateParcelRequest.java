package com.landregistry.api.dto;

import com.landregistry.parcels.LandType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for registering a new land parcel.
 */
@Data
public class CreateParcelRequest {

    @NotBlank(message = "Parcel number is required")
    @Pattern(regexp = "^[A-Z0-9-]{3,50}$", message = "Parcel number must be 3-50 characters of A-Z, 0-9 and '-'")
    private String parcelNumber;

    @NotBlank(message = "Location is required")
    @Size(min = 5, max = 500, message = "Location must be 5-500 characters")
    private String location;

    @NotNull(message = "Area is required")
    @DecimalMin(value = "0", inclusive = false, message = "Area must be positive")
    private BigDecimal area;

    @NotNull(message = "Land type is required")
    private LandType landType;

    @PositiveOrZero(message = "Market value cannot be negative")
    private BigDecimal marketValue;

    @Size(max = 255, message = "District must be at most 255 characters")
    private String district;

    @Size(max = 255, message = "Village must be at most 255 characters")
    private String village;

    @NotBlank(message = "Operator ID is required")
    @Size(max = 255, message = "Operator ID must be at most 255 characters")
    private String operatorId;
}
