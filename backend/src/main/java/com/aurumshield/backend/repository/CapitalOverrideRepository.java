package com.aurumshield.backend.repository;

import com.aurumshield.backend.capital.OverrideStatus;
import com.aurumshield.backend.entity.CapitalOverrideEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface CapitalOverrideRepository extends JpaRepository<CapitalOverrideEntity, String> {

    List<CapitalOverrideEntity> findAllByOrderByCreatedAtDesc();

    List<CapitalOverrideEntity> findByStatusAndExpiresAtLessThanEqual(OverrideStatus status, Instant cutoff);

    /**
     * Moves an override to {@code next} only if it is still in {@code expected}. Returns the number of rows changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update CapitalOverrideEntity o set o.status = :next where o.id = :id and o.status = :expected")
    int compareAndSetStatus(@Param("id") String id,
                            @Param("expected") OverrideStatus expected,
                            @Param("next") OverrideStatus next);

    /**
     * ACTIVE to REVOKED with attribution, same compare-and-swap semantics as {@link #compareAndSetStatus}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update CapitalOverrideEntity o set o.status = com.aurumshield.backend.capital.OverrideStatus.REVOKED, "
            + "o.revokedAt = :revokedAt, o.revokedBy = :revokedBy "
            + "where o.id = :id and o.status = com.aurumshield.backend.capital.OverrideStatus.ACTIVE "
            + "and o.expiresAt > :revokedAt")
    int revokeIfActive(@Param("id") String id,
                       @Param("revokedAt") Instant revokedAt,
                       @Param("revokedBy") String revokedBy);
}
