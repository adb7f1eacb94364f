package com.landregistry.parcels;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A registrable unit of land.
 *
 * Parcels are never deleted: certificates keep referring to them after revocation.
 * The only status change made by this engine is {@link #markRegistered(Instant)} on approval.
 */
@Entity
@Table(name = "parcels",
    uniqueConstraints = @UniqueConstraint(name = Parcel.PARCEL_NUMBER_CONSTRAINT, columnNames = "parcel_number"),
    indexes = {
        @Index(name = "idx_parcel_status", columnList = "status"),
        @Index(name = "idx_parcel_land_type", columnList = "land_type")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Parcel {

    public static final String PARCEL_NUMBER_CONSTRAINT = "uk_parcel_number";
    public static final int MAX_LOCATION_LENGTH = 500;
    public static final int MAX_NAME_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "parcel_number", nullable = false, length = 50)
    private String parcelNumber;

    @Column(name = "location", nullable = false, length = MAX_LOCATION_LENGTH)
    private String location;

    /**
     * Area in hectares.
     */
    @Column(name = "area", nullable = false, precision = 12, scale = 4)
    private BigDecimal area;

    @Enumerated(EnumType.STRING)
    @Column(name = "land_type", nullable = false, length = 20)
    private LandType landType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ParcelStatus status;

    @Column(name = "market_value", precision = 15, scale = 2)
    private BigDecimal marketValue;

    private String district;

    private String village;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Parcel(String parcelNumber, String location, BigDecimal area, LandType landType,
                  BigDecimal marketValue, String district, String village, Instant now) {
        this.parcelNumber = parcelNumber;
        this.location = location;
        this.area = area;
        this.landType = landType;
        this.marketValue = marketValue;
        this.district = district;
        this.village = village;
        this.status = ParcelStatus.AVAILABLE;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void markRegistered(Instant now) {
        this.status = ParcelStatus.REGISTERED;
        this.updatedAt = now;
    }

    public boolean isRegistered() {
        return status == ParcelStatus.REGISTERED;
    }
}
