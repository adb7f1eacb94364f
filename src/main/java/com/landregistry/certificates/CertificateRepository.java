package com.landregistry.certificates;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface CertificateRepository extends JpaRepository<Certificate, String> {

    Optional<Certificate> findByCertificateNumber(String certificateNumber);

    Optional<Certificate> findByVerificationCode(String verificationCode);

    Optional<Certificate> findByApplicationId(String applicationId);

    boolean existsByApplicationId(String applicationId);

    boolean existsByVerificationCode(String verificationCode);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Certificate c WHERE c.id = :id")
    Optional<Certificate> findByIdForUpdate(@Param("id") String id);

    long countByStatus(CertificateStatus status);

    long countByStatusAndExpiresAtBefore(CertificateStatus status, Instant instant);

    long countByIssuedAtAfter(Instant instant);
}
