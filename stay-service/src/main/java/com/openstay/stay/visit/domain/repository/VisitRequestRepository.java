package com.openstay.stay.visit.domain.repository;

import com.openstay.stay.visit.domain.model.VisitRequest;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface VisitRequestRepository extends JpaRepository<VisitRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VisitRequest v WHERE v.pendingKey = :pendingKey")
    Optional<VisitRequest> findPendingForUpdate(@Param("pendingKey") String pendingKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VisitRequest v WHERE v.id = :id")
    Optional<VisitRequest> findByIdForUpdate(@Param("id") Long id);

    List<VisitRequest> findByUserEmailIgnoreCaseOrderByCreatedAtDescIdDesc(String userEmail);

    List<VisitRequest> findByListingIdOrderByCreatedAtDescIdDesc(Long listingId);
}
