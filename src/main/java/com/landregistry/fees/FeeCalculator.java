package com.landregistry.fees;

import com.landregistry.applications.ApplicationType;
import com.landregistry.common.Money;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.config.LandRegistryProperties;
import com.landregistry.parcels.LandType;
import com.landregistry.parcels.Parcel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Computes application fees from the configured fee schedule.
 *
 * <pre>
 * fee = (baseFee + area * areaRatePerHectare * landTypeMultiplier)
 *       * applicationTypeMultiplier
 *       * priorityMultiplier
 * </pre>
 *
 * The result is rounded half-up to the minor units of the fee currency. The calculation has no
 * state of its own: identical inputs always produce identical fees.
 */
@Component
@RequiredArgsConstructor
public class FeeCalculator {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    private final LandRegistryProperties properties;

    public Money computeFee(Parcel parcel, ApplicationType applicationType, int priority) {
        if (parcel == null) {
            throw new InvalidInputException("Parcel is required to compute a fee");
        }
        return computeFee(parcel.getArea(), parcel.getLandType(), applicationType, priority);
    }

    public Money computeFee(BigDecimal area, LandType landType, ApplicationType applicationType, int priority) {
        if (area == null || area.signum() <= 0) {
            throw new InvalidInputException("Parcel area must be positive: " + area);
        }
        LandRegistryProperties.Fees fees = properties.getFees();

        BigDecimal landTypeMultiplier = lookup(fees.getLandTypeMultipliers().get(landType), "land type", landType);
        BigDecimal typeMultiplier = lookup(
            fees.getApplicationTypeMultipliers().get(applicationType), "application type", applicationType);
        BigDecimal priorityMultiplier = lookup(fees.getPriorityMultipliers().get(priority), "priority", priority);

        BigDecimal areaCharge = area
            .multiply(fees.getAreaRatePerHectare())
            .multiply(landTypeMultiplier);

        BigDecimal amount = fees.getBaseFee()
            .add(areaCharge)
            .multiply(typeMultiplier)
            .multiply(priorityMultiplier);

        return Money.of(amount, fees.getCurrency());
    }

    private static BigDecimal lookup(BigDecimal multiplier, String dimension, Object key) {
        if (key == null || multiplier == null) {
            throw new InvalidInputException("No fee multiplier for " + dimension + ": " + key);
        }
        return multiplier;
    }
}
