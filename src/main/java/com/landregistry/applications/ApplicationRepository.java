package com.landregistry.applications;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for application persistence.
 */
@Repository
public interface ApplicationRepository extends JpaRepository<Application, String> {

    /**
     * Load an application holding a row lock until the current transaction ends,
     * so concurrent reviewers cannot both decide the same application.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Application a WHERE a.id = :id")
    Optional<Application> findByIdForUpdate(@Param("id") String id);

    Optional<Application> findFirstByApplicantIdAndParcelIdAndStatusIn(
        String applicantId, String parcelId, Collection<ApplicationStatus> statuses);

    List<Application> findByApplicantIdOrderByCreatedAtDesc(String applicantId);

    long countByParcelIdAndStatus(String parcelId, ApplicationStatus status);

    long countByStatus(ApplicationStatus status);

    long countByPaymentStatus(PaymentStatus paymentStatus);

    @Query("SELECT AVG(a.fee.amount) FROM Application a")
    Double averageFee();

    @Query("SELECT SUM(a.fee.amount) FROM Application a")
    BigDecimal totalFees();
}
