package com.landregistry.parcels;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Repository for land parcel persistence.
 */
@Repository
public interface ParcelRepository extends JpaRepository<Parcel, String> {

    Optional<Parcel> findByParcelNumber(String parcelNumber);

    boolean existsByParcelNumber(String parcelNumber);

    /**
     * Load a parcel holding a row lock until the current transaction ends.
     * Serialises submissions and approvals against the same parcel.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Parcel p WHERE p.id = :id")
    Optional<Parcel> findByIdForUpdate(@Param("id") String id);

    long countByStatus(ParcelStatus status);

    @Query("SELECT SUM(p.area) FROM Parcel p")
    BigDecimal sumArea();

    @Query("SELECT AVG(p.area) FROM Parcel p")
    Double averageArea();
}
