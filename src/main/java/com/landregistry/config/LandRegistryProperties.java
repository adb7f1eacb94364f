package com.landregistry.config;

import com.landregistry.applications.ApplicationType;
import com.landregistry.common.Currency;
import com.landregistry.parcels.LandType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Externalised registry settings, bound from the {@code land-registry} prefix.
 *
 * <pre>
 * land-registry:
 *   fees:
 *     currency: XAF
 *     base-fee: 50000
 *     area-rate-per-hectare: 1000
 *   workflow:
 *     require-payment-for-approval: false
 *     transaction-timeout: 30s
 *   certificates:
 *     validity-years: 99
 * </pre>
 *
 * Every value has a default matching the published fee schedule, so an empty
 * configuration is a valid one.
 */
@Data
@ConfigurationProperties(prefix = "land-registry")
public class LandRegistryProperties {

    private Fees fees = new Fees();

    private Workflow workflow = new Workflow();

    private Certificates certificates = new Certificates();

    @Data
    public static class Fees {

        private Currency currency = Currency.XAF;

        private BigDecimal baseFee = new BigDecimal("50000");

        private BigDecimal areaRatePerHectare = new BigDecimal("1000");

        private Map<LandType, BigDecimal> landTypeMultipliers = defaultLandTypeMultipliers();

        private Map<ApplicationType, BigDecimal> applicationTypeMultipliers = defaultApplicationTypeMultipliers();

        private Map<Integer, BigDecimal> priorityMultipliers = defaultPriorityMultipliers();

        private static Map<LandType, BigDecimal> defaultLandTypeMultipliers() {
            Map<LandType, BigDecimal> multipliers = new EnumMap<>(LandType.class);
            multipliers.put(LandType.RESIDENTIAL, new BigDecimal("1.0"));
            multipliers.put(LandType.COMMERCIAL, new BigDecimal("2.0"));
            multipliers.put(LandType.AGRICULTURAL, new BigDecimal("0.5"));
            multipliers.put(LandType.INDUSTRIAL, new BigDecimal("1.5"));
            return multipliers;
        }

        private static Map<ApplicationType, BigDecimal> defaultApplicationTypeMultipliers() {
            Map<ApplicationType, BigDecimal> multipliers = new EnumMap<>(ApplicationType.class);
            multipliers.put(ApplicationType.REGISTRATION, new BigDecimal("1.0"));
            multipliers.put(ApplicationType.TRANSFER, new BigDecimal("1.2"));
            multipliers.put(ApplicationType.SUBDIVISION, new BigDecimal("1.5"));
            multipliers.put(ApplicationType.MUTATION, new BigDecimal("0.8"));
            return multipliers;
        }

        private static Map<Integer, BigDecimal> defaultPriorityMultipliers() {
            Map<Integer, BigDecimal> multipliers = new HashMap<>();
            multipliers.put(1, new BigDecimal("1.0"));  // normal
            multipliers.put(2, new BigDecimal("1.5"));  // high
            multipliers.put(3, new BigDecimal("2.0"));  // urgent
            multipliers.put(4, new BigDecimal("3.0"));  // emergency
            multipliers.put(5, new BigDecimal("5.0"));  // critical
            return multipliers;
        }
    }

    @Data
    public static class Workflow {

        /**
         * Refuse approval until the application fee is paid.
         */
        private boolean requirePaymentForApproval = false;

        private Duration transactionTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Certificates {

        private int validityYears = 99;

        private String numberPrefix = "CERT";

        private int verificationCodeLength = 16;
    }
}
