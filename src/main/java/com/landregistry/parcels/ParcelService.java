package com.landregistry.parcels;

import com.landregistry.applications.ApplicationRepository;
import com.landregistry.applications.ApplicationStatus;
import com.landregistry.audit.AuditAction;
import com.landregistry.audit.AuditEntry;
import com.landregistry.common.DataIntegrityErrors;
import com.landregistry.common.exception.DuplicateParcelNumberException;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.common.exception.ParcelNotFoundException;
import com.landregistry.transaction.TransactionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Parcel registry: owns land parcel records and their registration status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParcelService {

    private static final Pattern PARCEL_NUMBER = Pattern.compile("^[A-Z0-9-]{3,50}$");
    private static final int MIN_LOCATION_LENGTH = 5;
    // integer digits allowed by the area (12,4) and market value (15,2) columns
    private static final int MAX_AREA_INTEGER_DIGITS = 8;
    private static final int MAX_MARKET_VALUE_INTEGER_DIGITS = 13;
    private static final int AREA_SCALE = 4;
    private static final int MARKET_VALUE_SCALE = 2;

    private final ParcelRepository parcelRepository;
    private final ApplicationRepository applicationRepository;
    private final TransactionCoordinator transactionCoordinator;
    private final Clock clock;

    public Parcel createParcel(CreateParcelCommand command, String operatorId) {
        validate(command);

        return transactionCoordinator.runInTransaction("createParcel", audit -> {
            if (parcelRepository.existsByParcelNumber(command.getParcelNumber())) {
                throw new DuplicateParcelNumberException(command.getParcelNumber());
            }

            Parcel parcel = new Parcel(
                command.getParcelNumber(),
                command.getLocation().trim(),
                command.getArea(),
                command.getLandType(),
                command.getMarketValue(),
                command.getDistrict(),
                command.getVillage(),
                clock.instant()
            );
            try {
                parcelRepository.saveAndFlush(parcel);
            } catch (DataIntegrityViolationException e) {
                if (DataIntegrityErrors.violates(e, Parcel.PARCEL_NUMBER_CONSTRAINT)) {
                    // a concurrent insert won the unique constraint on parcel_number
                    throw new DuplicateParcelNumberException(command.getParcelNumber());
                }
                throw e;
            }

            audit.record(AuditEntry.builder()
                .actorId(operatorId)
                .action(AuditAction.PARCEL_CREATED)
                .resourceType("parcel")
                .resourceId(parcel.getId())
                .details("Parcel " + parcel.getParcelNumber() + " created")
                .attribute("parcelNumber", parcel.getParcelNumber())
                .attribute("landType", parcel.getLandType().name())
                .attribute("area", parcel.getArea().toPlainString())
                .build());

            log.info("Created parcel {} ({}, {} ha) as {}",
                parcel.getParcelNumber(), parcel.getLandType(), parcel.getArea(), parcel.getId());
            return parcel;
        });
    }

    @Transactional(readOnly = true)
    public Parcel getParcel(String parcelId) {
        return parcelRepository.findById(parcelId)
            .orElseThrow(() -> new ParcelNotFoundException(parcelId));
    }

    @Transactional(readOnly = true)
    public Parcel getParcelByNumber(String parcelNumber) {
        return parcelRepository.findByParcelNumber(parcelNumber)
            .orElseThrow(() -> new ParcelNotFoundException(parcelNumber));
    }

    /**
     * Load a parcel and hold its row lock for the rest of the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Parcel lockParcel(String parcelId) {
        return parcelRepository.findByIdForUpdate(parcelId)
            .orElseThrow(() -> new ParcelNotFoundException(parcelId));
    }

    /**
     * Number of approved applications for the parcel, as seen by the current transaction.
     * Only meaningful while the caller holds the parcel lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long countApprovedApplications(String parcelId) {
        return applicationRepository.countByParcelIdAndStatus(parcelId, ApplicationStatus.APPROVED);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markRegistered(Parcel parcel) {
        parcel.markRegistered(clock.instant());
        parcelRepository.save(parcel);
        log.info("Parcel {} marked registered", parcel.getParcelNumber());
    }

    @Transactional(readOnly = true)
    public ParcelStats getParcelStats() {
        BigDecimal totalArea = parcelRepository.sumArea();
        Double averageArea = parcelRepository.averageArea();
        return ParcelStats.builder()
            .totalParcels(parcelRepository.count())
            .availableParcels(parcelRepository.countByStatus(ParcelStatus.AVAILABLE))
            .registeredParcels(parcelRepository.countByStatus(ParcelStatus.REGISTERED))
            .disputedParcels(parcelRepository.countByStatus(ParcelStatus.DISPUTED))
            .underReviewParcels(parcelRepository.countByStatus(ParcelStatus.UNDER_REVIEW))
            .totalArea(totalArea == null ? BigDecimal.ZERO : totalArea)
            .averageArea(averageArea == null
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(averageArea).setScale(4, RoundingMode.HALF_UP))
            .build();
    }

    private void validate(CreateParcelCommand command) {
        if (command.getParcelNumber() == null || !PARCEL_NUMBER.matcher(command.getParcelNumber()).matches()) {
            throw new InvalidInputException("Parcel number must be 3-50 characters of A-Z, 0-9 and '-': "
                + command.getParcelNumber());
        }
        String location = command.getLocation() == null ? "" : command.getLocation().trim();
        if (location.length() < MIN_LOCATION_LENGTH || location.length() > Parcel.MAX_LOCATION_LENGTH) {
            throw new InvalidInputException("Parcel location must be " + MIN_LOCATION_LENGTH + "-"
                + Parcel.MAX_LOCATION_LENGTH + " characters");
        }
        if (command.getArea() == null || command.getArea().signum() <= 0) {
            throw new InvalidInputException("Parcel area must be positive: " + command.getArea());
        }
        if (integerDigits(command.getArea()) > MAX_AREA_INTEGER_DIGITS
                || command.getArea().stripTrailingZeros().scale() > AREA_SCALE) {
            throw new InvalidInputException("Parcel area must have at most " + MAX_AREA_INTEGER_DIGITS
                + " integer digits and " + AREA_SCALE + " decimals: " + command.getArea());
        }
        if (command.getLandType() == null) {
            throw new InvalidInputException("Land type is required");
        }
        if (command.getMarketValue() != null && command.getMarketValue().signum() < 0) {
            throw new InvalidInputException("Market value cannot be negative: " + command.getMarketValue());
        }
        if (command.getMarketValue() != null
                && (integerDigits(command.getMarketValue()) > MAX_MARKET_VALUE_INTEGER_DIGITS
                    || command.getMarketValue().stripTrailingZeros().scale() > MARKET_VALUE_SCALE)) {
            throw new InvalidInputException("Market value must have at most " + MAX_MARKET_VALUE_INTEGER_DIGITS
                + " integer digits and " + MARKET_VALUE_SCALE + " decimals: " + command.getMarketValue());
        }
        checkLength("District", command.getDistrict());
        checkLength("Village", command.getVillage());
    }

    private static void checkLength(String field, String value) {
        if (value != null && value.length() > Parcel.MAX_NAME_LENGTH) {
            throw new InvalidInputException(field + " must be at most " + Parcel.MAX_NAME_LENGTH + " characters");
        }
    }

    private static int integerDigits(BigDecimal value) {
        return Math.max(0, value.precision() - value.scale());
    }
}
