package com.loanorigination.repository;

import com.loanorigination.model.CreditApplication;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped access to applications. Soft-deleted rows are never returned.
 */
@Repository
public interface CreditApplicationRepository extends JpaRepository<CreditApplication, String> {

    @Query("SELECT a FROM CreditApplication a "
         + "WHERE a.tenantId = :tenantId AND a.applicationId = :applicationId AND a.deletedAt IS NULL")
    Optional<CreditApplication> findActive(@Param("tenantId") String tenantId,
                                           @Param("applicationId") String applicationId);

    /**
     * Same as {@link #findActive} but takes a row lock for the rest of the
     * transaction, so two status changes on one application run one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CreditApplication a "
         + "WHERE a.tenantId = :tenantId AND a.applicationId = :applicationId AND a.deletedAt IS NULL")
    Optional<CreditApplication> findActiveForUpdate(@Param("tenantId") String tenantId,
                                                    @Param("applicationId") String applicationId);

    List<CreditApplication> findByTenantIdAndApplicantIdAndDeletedAtIsNullOrderByCreatedAtDesc(
            String tenantId, String applicantId);
}
