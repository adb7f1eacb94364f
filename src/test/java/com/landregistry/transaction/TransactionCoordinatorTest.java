package com.landregistry.transaction;

import com.landregistry.TestFixtures;
import com.landregistry.applications.Application;
import com.landregistry.applications.ApplicationService;
import com.landregistry.applications.ApplicationStatus;
import com.landregistry.audit.AuditAction;
import com.landregistry.audit.AuditEntry;
import com.landregistry.audit.AuditEventRepository;
import com.landregistry.certificates.CertificateRepository;
import com.landregistry.common.exception.AuditWriteException;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.common.exception.TransactionTimeoutException;
import com.landregistry.parcels.LandType;
import com.landregistry.parcels.Parcel;
import com.landregistry.parcels.ParcelRepository;
import com.landregistry.parcels.ParcelService;
import com.landregistry.parcels.ParcelStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the unit-of-work boundary.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransactionCoordinatorTest {

    @Autowired
    private TransactionCoordinator transactionCoordinator;

    @Autowired
    private ParcelRepository parcelRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @Autowired
    private ParcelService parcelService;

    @Autowired
    private ApplicationService applicationService;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void testAuditedWorkCommits() {
        String parcelNumber = TestFixtures.uniqueParcelNumber();

        Parcel parcel = transactionCoordinator.runInTransaction("test", audit -> {
            Parcel saved = parcelRepository.save(newParcel(parcelNumber));
            audit.record(created(saved));
            return saved;
        });

        assertTrue(parcelRepository.existsByParcelNumber(parcelNumber));
        assertEquals(1, auditEventRepository.countByResourceTypeAndResourceIdAndAction(
            "parcel", parcel.getId(), AuditAction.PARCEL_CREATED));
    }

    @Test
    void testUnauditedWorkIsRolledBack() {
        String parcelNumber = TestFixtures.uniqueParcelNumber();

        assertThrows(IllegalStateException.class, () ->
            transactionCoordinator.runInTransaction("test", audit -> parcelRepository.save(newParcel(parcelNumber))));

        assertFalse(parcelRepository.existsByParcelNumber(parcelNumber));
    }

    @Test
    void testFailureRollsBackWritesAndAudit() {
        String parcelNumber = TestFixtures.uniqueParcelNumber();
        String[] parcelId = new String[1];

        assertThrows(InvalidInputException.class, () ->
            transactionCoordinator.runInTransaction("test", audit -> {
                Parcel saved = parcelRepository.saveAndFlush(newParcel(parcelNumber));
                parcelId[0] = saved.getId();
                audit.record(created(saved));
                throw new InvalidInputException("rejected after write");
            }));

        assertFalse(parcelRepository.existsByParcelNumber(parcelNumber));
        assertEquals(0, auditEventRepository.countByResourceTypeAndResourceIdAndAction(
            "parcel", parcelId[0], AuditAction.PARCEL_CREATED));
    }

    @Test
    void testAuditWriteFailureRollsBackWork() {
        String parcelNumber = TestFixtures.uniqueParcelNumber();

        assertThrows(AuditWriteException.class, () ->
            transactionCoordinator.runInTransaction("test", audit -> {
                Parcel saved = parcelRepository.save(newParcel(parcelNumber));
                audit.record(AuditEntry.builder()
                    .action(AuditAction.PARCEL_CREATED)
                    .resourceType("parcel")
                    .resourceId(saved.getId())
                    .details("d".repeat(3000))
                    .build());
                return saved;
            }));

        assertFalse(parcelRepository.existsByParcelNumber(parcelNumber));
    }

    @Test
    void testLockWaitTimesOutAndRollsBack() throws Exception {
        Parcel parcel = parcelService.createParcel(
            TestFixtures.residentialParcel(TestFixtures.uniqueParcelNumber(), "1.0"), "operator-1");
        Application application = applicationService.submitApplication(
            TestFixtures.registration(TestFixtures.uniqueId("applicant"), parcel.getId()));

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            TransactionTemplate holderTransaction = new TransactionTemplate(transactionManager);
            Future<?> holder = executor.submit(() -> holderTransaction.executeWithoutResult(status -> {
                parcelRepository.findByIdForUpdate(parcel.getId()).orElseThrow();
                locked.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(locked.await(10, TimeUnit.SECONDS));

            assertThrows(TransactionTimeoutException.class, () ->
                applicationService.transitionApplication(
                    application.getId(), ApplicationStatus.APPROVED, "reviewer-1", "approved while locked"));

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        Application unchanged = applicationService.getApplication(application.getId());
        assertEquals(ApplicationStatus.PENDING, unchanged.getStatus());
        assertNull(unchanged.getReviewedBy());
        assertFalse(certificateRepository.existsByApplicationId(application.getId()));
        assertEquals(ParcelStatus.AVAILABLE, parcelService.getParcel(parcel.getId()).getStatus());
        assertEquals(0, auditEventRepository.countByResourceTypeAndResourceIdAndAction(
            "application", application.getId(), AuditAction.APPLICATION_STATUS_CHANGED));
    }

    private static Parcel newParcel(String parcelNumber) {
        return new Parcel(parcelNumber, "Akwa, Douala", new BigDecimal("1.2"), LandType.COMMERCIAL,
            null, null, null, Instant.now());
    }

    private static AuditEntry created(Parcel parcel) {
        return AuditEntry.builder()
            .action(AuditAction.PARCEL_CREATED)
            .resourceType("parcel")
            .resourceId(parcel.getId())
            .build();
    }
}
