package com.landregistry.applications;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate application counts and fee totals.
 */
@Value
@Builder
public class ApplicationStats {
    long totalApplications;
    long pendingApplications;
    long underReviewApplications;
    long approvedApplications;
    long rejectedApplications;
    long cancelledApplications;
    long paidApplications;
    long paymentPending;
    BigDecimal averageFee;
    BigDecimal totalFees;
}
