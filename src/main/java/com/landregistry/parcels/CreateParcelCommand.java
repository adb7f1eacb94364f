package com.landregistry.parcels;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Attributes of a parcel being entered into the registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateParcelCommand {

    /**
     * Public parcel number, e.g. {@code LP-2025-001}.
     */
    private String parcelNumber;

    private String location;

    /**
     * Area in hectares. Must be positive.
     */
    private BigDecimal area;

    private LandType landType;

    private BigDecimal marketValue;

    private String district;

    private String village;
}
