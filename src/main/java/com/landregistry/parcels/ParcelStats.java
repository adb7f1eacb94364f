package com.landregistry.parcels;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate parcel counts for dashboards.
 */
@Value
@Builder
public class ParcelStats {
    long totalParcels;
    long availableParcels;
    long registeredParcels;
    long disputedParcels;
    long underReviewParcels;
    BigDecimal totalArea;
    BigDecimal averageArea;
}
